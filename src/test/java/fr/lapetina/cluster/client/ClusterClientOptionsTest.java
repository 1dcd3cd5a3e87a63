package fr.lapetina.cluster.client;

import fr.lapetina.cluster.client.infrastructure.config.ConfigLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterClientOptionsTest {

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        ClusterClientOptions options = ClusterClientOptions.defaults();

        assertThat(options.getUrls()).containsExactly("http://127.0.0.1:9200");
        assertThat(options.isSnifferEnabled()).isTrue();
        assertThat(options.getSnifferStartupTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.getSnifferTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(options.getSnifferInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(options.isHealthcheckEnabled()).isTrue();
        assertThat(options.getHealthcheckStartupTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.getHealthcheckTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.getHealthcheckInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(options.getMaxRetries()).isZero();
        assertThat(options.getBasicAuth()).isNull();
        assertThat(options.getInfoLog()).isNull();
        assertThat(options.getTraceLog()).isNull();
        assertThat(options.getErrorLog()).isNull();
        assertThat(options.getSendGetBodyAs()).isEqualTo("GET");
        assertThat(options.getScheme()).isEqualTo("http");
        assertThat(options.getMeterRegistry()).isNull();
        assertThat(options.getMetricsPrefix()).isEqualTo("cluster_client");
    }

    @Test
    @DisplayName("should replace the URL list instead of appending to it")
    void shouldReplaceUrls() {
        ClusterClientOptions options = ClusterClientOptions.builder()
                .urls("http://10.0.0.1:9200")
                .urls("http://10.0.0.2:9200/", "HTTP://10.0.0.3:9200", "http://10.0.0.2:9200")
                .build();

        assertThat(options.getUrls()).containsExactly("http://10.0.0.2:9200", "http://10.0.0.3:9200");
    }

    @Test
    @DisplayName("should fall back to the default URL when none is given")
    void shouldFallBackToDefaultUrl() {
        ClusterClientOptions options = ClusterClientOptions.builder().urls(List.of()).build();

        assertThat(options.getUrls()).containsExactly("http://127.0.0.1:9200");
    }

    @Test
    @DisplayName("should let later settings override earlier ones")
    void shouldOverrideEarlierSettings() {
        ClusterClientOptions options = ClusterClientOptions.builder()
                .maxRetries(5)
                .sniff(false)
                .maxRetries(1)
                .sniff(true)
                .basicAuth("user", "secret")
                .build();

        assertThat(options.getMaxRetries()).isEqualTo(1);
        assertThat(options.isSnifferEnabled()).isTrue();
        assertThat(options.getBasicAuth().username()).isEqualTo("user");
        assertThat(options.toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> ClusterClientOptions.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().snifferInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().healthcheckTimeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().urls("ftp://10.0.0.1").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().scheme("tcp").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().sendGetBodyAs(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClusterClientOptions.builder().basicAuth("", "secret"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should apply a loaded configuration")
    void shouldApplyConfiguration() {
        ClusterClientOptions options = ClusterClientOptions.builder()
                .fromConfig(new ConfigLoader("test-client.yaml").load())
                .build();

        assertThat(options.getUrls()).containsExactly("http://10.0.0.1:9200", "http://10.0.0.2:9200");
        assertThat(options.isSnifferEnabled()).isFalse();
        assertThat(options.getSnifferStartupTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(options.getSnifferInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(options.isHealthcheckEnabled()).isTrue();
        assertThat(options.getHealthcheckTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(options.getMaxRetries()).isEqualTo(2);
        assertThat(options.getRetryBackoff().getInitial()).isEqualTo(Duration.ofMillis(50));
        assertThat(options.getRetryBackoff().getMultiplier()).isEqualTo(3.0);
        assertThat(options.getBasicAuth().username()).isEqualTo("elastic");
        assertThat(options.getBasicAuth().password()).isEqualTo("changeme");
        assertThat(options.getScheme()).isEqualTo("https");
        assertThat(options.getSendGetBodyAs()).isEqualTo("POST");
        assertThat(options.getConnectTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(options.getMetricsPrefix()).isEqualTo("test_client");
        assertThat(options.getMeterRegistry()).isInstanceOf(SimpleMeterRegistry.class);
    }
}
