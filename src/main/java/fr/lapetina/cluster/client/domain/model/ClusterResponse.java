package fr.lapetina.cluster.client.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response obtained from a cluster node.
 * Immutable and thread-safe. Interpreting the body is left to the caller.
 *
 * @param statusCode HTTP status
 * @param headers    response headers, keys compared case-insensitively
 * @param body       response body decoded as UTF-8, empty for HEAD requests
 */
public record ClusterResponse(
        int statusCode,
        Map<String, List<String>> headers,
        String body
) {
    public ClusterResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body != null ? body : "";
    }

    public static ClusterResponse of(int statusCode, String body) {
        return new ClusterResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }
}
