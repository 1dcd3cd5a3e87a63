package fr.lapetina.cluster.client;

import fr.lapetina.cluster.client.domain.model.ClusterRequest;
import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.exception.NoNodeAvailableException;
import fr.lapetina.cluster.client.exception.PoolExhaustedException;
import fr.lapetina.cluster.client.exception.ResponseStatusException;
import fr.lapetina.cluster.client.exception.TransportException;
import fr.lapetina.cluster.client.infrastructure.http.RetryBackoff;
import fr.lapetina.cluster.client.support.FakeNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ClusterClientTest {

    private FakeNode node;
    private ClusterClient client;

    @BeforeEach
    void setUp() {
        node = FakeNode.start()
                .nodesInfoSelf()
                .reply("/_cluster/health", 200, "{\"status\":\"green\"}");
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        node.close();
    }

    private ClusterClientOptions.Builder offline(String... urls) {
        return ClusterClientOptions.builder()
                .urls(urls)
                .sniff(false)
                .healthcheck(false)
                .meterRegistry(new SimpleMeterRegistry());
    }

    private static String closedUrl() {
        FakeNode closed = FakeNode.start();
        String url = closed.url();
        closed.close();
        return url;
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should keep exactly the seed URLs when discovery and health checks are disabled")
        void shouldKeepSeedUrls() {
            client = ClusterClient.create(offline("http://10.0.0.1:9200", "http://10.0.0.2:9200").build());

            assertThat(client.connectionPool().snapshot()).extracting(Connection::getUrl)
                    .containsExactly("http://10.0.0.1:9200", "http://10.0.0.2:9200");
            assertThat(client.connectionPool().snapshot()).allSatisfy(c -> assertThat(c.isAlive()).isTrue());
            assertThat(client.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should discover the cluster and pass the health check at startup")
        void shouldDiscoverAtStartup() {
            client = ClusterClient.create(ClusterClientOptions.builder()
                    .urls(node.url())
                    .meterRegistry(new SimpleMeterRegistry())
                    .build());

            assertThat(client.connectionPool().snapshot()).extracting(Connection::getUrl)
                    .containsExactly(node.url());
            assertThat(node.requestCount("/_nodes/http")).isEqualTo(1);
            assertThat(node.requests()).anySatisfy(r -> assertThat(r.method()).isEqualTo("HEAD"));
        }

        @Test
        @DisplayName("should fail after the startup timeout when discovery finds no node")
        void shouldFailWhenDiscoveryFindsNothing() {
            ClusterClientOptions options = ClusterClientOptions.builder()
                    .urls(closedUrl())
                    .snifferStartupTimeout(Duration.ofMillis(500))
                    .meterRegistry(new SimpleMeterRegistry())
                    .build();

            long start = System.nanoTime();
            assertThatThrownBy(() -> ClusterClient.create(options))
                    .isInstanceOf(NoNodeAvailableException.class);

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(500));
        }

        @Test
        @DisplayName("should fail when no node passes the startup health check")
        void shouldFailWhenHealthCheckFails() {
            node.reply("/", 503, "");
            ClusterClientOptions options = ClusterClientOptions.builder()
                    .urls(node.url())
                    .sniff(false)
                    .healthcheckStartupTimeout(Duration.ofMillis(500))
                    .meterRegistry(new SimpleMeterRegistry())
                    .build();

            assertThatThrownBy(() -> ClusterClient.create(options))
                    .isInstanceOf(NoNodeAvailableException.class)
                    .hasMessageContaining("health check");
        }

        @Test
        @DisplayName("should create a client from a configuration file")
        void shouldCreateFromConfigurationFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("client.yaml");
            Files.writeString(file, "urls:\n  - " + node.url() + "\n"
                    + "sniffer:\n  enabled: false\n"
                    + "healthcheck:\n  enabled: false\n"
                    + "metrics:\n  enabled: false\n");

            client = ClusterClient.create(file.toString());

            assertThat(client.options().getUrls()).containsExactly(node.url());
            assertThat(client.options().isSnifferEnabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should treat start and stop as idempotent")
        void shouldBeIdempotent() {
            client = ClusterClient.create(ClusterClientOptions.builder()
                    .urls(node.url())
                    .meterRegistry(new SimpleMeterRegistry())
                    .build());
            assertThat(client.isRunning()).isTrue();

            client.start();
            assertThat(client.isRunning()).isTrue();

            client.stop();
            assertThat(client.isRunning()).isFalse();
            client.stop();
            assertThat(client.isRunning()).isFalse();

            client.start();
            assertThat(client.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should start and stop with discovery and health checks disabled")
        void shouldStartAndStopWithoutBackgroundTasks() throws Exception {
            client = ClusterClient.create(offline(node.url()).build());

            client.stop();
            assertThat(client.isRunning()).isFalse();
            client.start();
            assertThat(client.isRunning()).isTrue();

            assertThat(client.performRequest("GET", "/_cluster/health").statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should run forced discovery and health passes")
        void shouldRunForcedPasses() {
            client = ClusterClient.create(offline(node.url()).build());
            client.connectionPool().markDead(client.connectionPool().snapshot().get(0));

            client.healthcheckNow();
            assertThat(client.connectionPool().aliveCount()).isEqualTo(1);

            client.sniffNow();
            assertThat(node.requestCount("/_nodes/http")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("requests")
    class RequestTests {

        @Test
        @DisplayName("should perform a request")
        void shouldPerformRequest() throws Exception {
            client = ClusterClient.create(offline(node.url()).build());

            ClusterResponse response = client.performRequest("GET", "/_cluster/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"status\":\"green\"}");
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                    assertThat(client.metrics().getRegistry().get("cluster_client_requests_total")
                            .tags("method", "GET", "outcome", "success").counter().count()).isEqualTo(1.0));
        }

        @Test
        @DisplayName("should perform a request asynchronously")
        void shouldPerformRequestAsync() throws Exception {
            client = ClusterClient.create(offline(node.url()).build());

            CompletableFuture<ClusterResponse> future =
                    client.performRequestAsync(ClusterRequest.get("/_cluster/health"));

            assertThat(future.get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should resurrect dead connections on the next call")
        void shouldResurrectDeadConnections() throws Exception {
            client = ClusterClient.create(offline(node.url()).build());
            client.connectionPool().markDead(client.connectionPool().snapshot().get(0));

            assertThatThrownBy(() -> client.performRequest("GET", "/_cluster/health"))
                    .isInstanceOf(PoolExhaustedException.class);

            assertThat(client.connectionPool().aliveCount()).isEqualTo(1);
            assertThat(client.performRequest("GET", "/_cluster/health").statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should retry transport failures up to the budget")
        void shouldRetryTransportFailures() {
            client = ClusterClient.create(offline(closedUrl())
                    .maxRetries(3)
                    .retryBackoff(RetryBackoff.none())
                    .build());

            assertThatThrownBy(() -> client.performRequest("GET", "/"))
                    .isInstanceOf(TransportException.class)
                    .satisfies(e -> assertThat(((TransportException) e).getAttempts()).isEqualTo(4));
            assertThat(client.metrics().getRegistry().get("cluster_client_attempts_total").counter().count())
                    .isEqualTo(4.0);
        }

        @Test
        @DisplayName("should not retry an HTTP error")
        void shouldNotRetryHttpError() {
            node.reply("/fail", 500, "{\"error\":\"boom\",\"status\":500}");
            client = ClusterClient.create(offline(node.url()).maxRetries(3).build());

            assertThatThrownBy(() -> client.performRequest("GET", "/fail"))
                    .isInstanceOf(ResponseStatusException.class)
                    .hasMessage("HTTP 500: boom");
            assertThat(node.requestCount("/fail")).isEqualTo(1);
        }

        @Test
        @DisplayName("should write request lines to the configured logger")
        void shouldWriteToInfoLogger() throws Exception {
            List<String> lines = new CopyOnWriteArrayList<>();
            client = ClusterClient.create(offline(node.url())
                    .infoLog((format, args) -> lines.add(String.format(Locale.ROOT, format, args)))
                    .build());

            client.performRequest("GET", "/_cluster/health");

            assertThat(lines).singleElement().asString()
                    .startsWith("GET " + node.url() + "/_cluster/health [status:200, request:");
        }
    }
}
