package fr.lapetina.cluster.client.infrastructure.http;

import fr.lapetina.cluster.client.exception.BodyEncodingException;
import fr.lapetina.cluster.client.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BodyEncoderTest {

    private final BodyEncoder encoder = new BodyEncoder();

    @Test
    @DisplayName("should send strings and byte arrays verbatim")
    void shouldSendVerbatim() {
        byte[] raw = {1, 2, 3};

        assertThat(encoder.encode(null)).isNull();
        assertThat(encoder.encode(raw)).isSameAs(raw);
        assertThat(new String(encoder.encode("{\"a\": 1}"), StandardCharsets.UTF_8)).isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("should write objects as JSON with ISO timestamps")
    void shouldWriteJson() {
        Document document = new Document("alice", Instant.parse("2024-01-02T03:04:05Z"), null);

        String json = new String(encoder.encode(document), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"user\":\"alice\",\"createdAt\":\"2024-01-02T03:04:05Z\"}");
        assertThat(new String(encoder.encode(Map.of("n", 1)), StandardCharsets.UTF_8)).isEqualTo("{\"n\":1}");
    }

    @Test
    @DisplayName("should report unserializable bodies")
    void shouldReportUnserializableBody() {
        assertThatThrownBy(() -> encoder.encode(new Object()))
                .isInstanceOf(BodyEncodingException.class)
                .satisfies(e -> assertThat(((BodyEncodingException) e).getErrorType()).isEqualTo(ErrorType.ENCODING_ERROR));
    }

    record Document(String user, Instant createdAt, String comment) {
    }
}
