package fr.lapetina.cluster.client.domain.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A request to be routed to one node of the cluster.
 * Immutable; the {@code with*} methods return modified copies.
 *
 * @param method       HTTP method, upper-cased
 * @param path         path relative to the node base URL, always starting with {@code /}
 * @param params       query parameters in insertion order
 * @param body         payload: {@code null}, a {@code String}, a {@code byte[]} or an object serialized as JSON
 * @param ignoreErrors non-success status codes that are returned as plain responses
 * @param timeout      per-call deadline covering all attempts, or {@code null} for none
 */
public record ClusterRequest(
        String method,
        String path,
        Map<String, String> params,
        Object body,
        Set<Integer> ignoreErrors,
        Duration timeout
) {
    public ClusterRequest {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(path, "Path is required");
        if (method.isBlank()) {
            throw new IllegalArgumentException("Method must not be blank");
        }
        method = method.toUpperCase(Locale.ROOT);
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
        ignoreErrors = ignoreErrors != null ? Set.copyOf(ignoreErrors) : Set.of();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    /**
     * Creates a request without parameters or body.
     */
    public static ClusterRequest of(String method, String path) {
        return new ClusterRequest(method, path, null, null, null, null);
    }

    public static ClusterRequest get(String path) {
        return of("GET", path);
    }

    public ClusterRequest withParam(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.put(name, value);
        return new ClusterRequest(method, path, copy, body, ignoreErrors, timeout);
    }

    public ClusterRequest withBody(Object newBody) {
        return new ClusterRequest(method, path, params, newBody, ignoreErrors, timeout);
    }

    public ClusterRequest withTimeout(Duration newTimeout) {
        return new ClusterRequest(method, path, params, body, ignoreErrors, newTimeout);
    }

    public ClusterRequest ignoring(Integer... statusCodes) {
        return new ClusterRequest(method, path, params, body, new LinkedHashSet<>(Arrays.asList(statusCodes)), timeout);
    }

    public boolean hasBody() {
        return body != null;
    }
}
