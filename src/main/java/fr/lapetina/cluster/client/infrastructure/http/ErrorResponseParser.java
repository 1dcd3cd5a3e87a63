package fr.lapetina.cluster.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts a readable reason from a node's error document.
 *
 * Understands {@code {"error": "text"}} and
 * {@code {"error": {"type": "...", "reason": "..."}, "status": 500}};
 * anything else yields {@code "no error details"}.
 */
final class ErrorResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponseParser.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    String reason(ClusterResponse response) {
        String fallback = "no error details";
        if (response.body().isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(response.body()).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.isObject()) {
                String type = error.path("type").asText("");
                String reason = error.path("reason").asText("");
                if (!type.isEmpty() && !reason.isEmpty()) {
                    return type + ": " + reason;
                }
                if (!reason.isEmpty()) {
                    return reason;
                }
                if (!type.isEmpty()) {
                    return type;
                }
            }
        } catch (Exception e) {
            log.debug("Error body is not a JSON error document: status={}, error={}",
                    response.statusCode(), e.getMessage());
        }
        return fallback;
    }
}
