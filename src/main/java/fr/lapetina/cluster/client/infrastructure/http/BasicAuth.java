package fr.lapetina.cluster.client.infrastructure.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Basic-auth credentials sent with every request, discovery call and probe.
 */
public record BasicAuth(String username, String password) {

    public BasicAuth {
        Objects.requireNonNull(username, "Username is required");
        if (username.isBlank()) {
            throw new IllegalArgumentException("Username must not be blank");
        }
        password = password != null ? password : "";
    }

    /**
     * Value of the {@code Authorization} header.
     */
    public String headerValue() {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BasicAuth{username='" + username + "'}";
    }
}
