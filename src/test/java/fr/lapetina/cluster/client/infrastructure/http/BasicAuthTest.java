package fr.lapetina.cluster.client.infrastructure.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BasicAuthTest {

    @Test
    @DisplayName("should build the Authorization header value")
    void shouldBuildHeader() {
        assertThat(new BasicAuth("user", "secret").headerValue()).isEqualTo("Basic dXNlcjpzZWNyZXQ=");
        assertThat(new BasicAuth("user", null).headerValue()).isEqualTo("Basic dXNlcjo=");
    }

    @Test
    @DisplayName("should hide the password")
    void shouldHidePassword() {
        assertThat(new BasicAuth("user", "secret").toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("should reject a blank username")
    void shouldRejectBlankUsername() {
        assertThatThrownBy(() -> new BasicAuth(" ", "secret")).isInstanceOf(IllegalArgumentException.class);
    }
}
