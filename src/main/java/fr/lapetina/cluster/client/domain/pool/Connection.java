package fr.lapetina.cluster.client.domain.pool;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A single node endpoint of the cluster plus its liveness state.
 *
 * The URL is the identity and never changes. Liveness is only changed by the
 * owning {@link ConnectionPool}, which serializes transitions under its lock;
 * reads are lock-free.
 */
public final class Connection {

    private final String nodeId;
    private final String url;

    // Mutable state, written under the pool lock
    private volatile boolean dead;
    private volatile int failures;
    private volatile Instant deadSince;

    private Connection(String nodeId, String url) {
        this.url = canonicalize(url);
        this.nodeId = nodeId != null ? nodeId : this.url;
    }

    /**
     * Creates a connection for a seed URL; the URL doubles as node id.
     */
    public static Connection of(String url) {
        return new Connection(null, url);
    }

    /**
     * Creates a connection for a node reported by the cluster.
     */
    public static Connection of(String nodeId, String url) {
        return new Connection(Objects.requireNonNull(nodeId, "Node ID is required"), url);
    }

    /**
     * Normalizes a node URL: http(s) only, lower-case scheme and host,
     * no user info, no trailing slash, no query or fragment.
     *
     * @throws IllegalArgumentException if the URL is malformed or not http(s)
     */
    public static String canonicalize(String rawUrl) {
        Objects.requireNonNull(rawUrl, "URL is required");
        URI uri;
        try {
            uri = new URI(rawUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid node URL: " + rawUrl, e);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("Node URL must use http or https: " + rawUrl);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Node URL has no host: " + rawUrl);
        }

        String path = uri.getRawPath() != null ? uri.getRawPath() : "";
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder(scheme)
                .append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.append(path).toString();
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getUrl() {
        return url;
    }

    public boolean isDead() {
        return dead;
    }

    public boolean isAlive() {
        return !dead;
    }

    public int getFailures() {
        return failures;
    }

    /**
     * Time of the last transition to dead, or {@code null} if the connection never failed.
     */
    public Instant getDeadSince() {
        return deadSince;
    }

    void markDead() {
        dead = true;
        failures = failures + 1;
        deadSince = Instant.now();
    }

    void markAlive() {
        dead = false;
    }

    /**
     * A successful request proves the node healthy: alive and failure count cleared.
     */
    void markHealthy() {
        dead = false;
        failures = 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return "Connection{" +
                "nodeId='" + nodeId + '\'' +
                ", url=" + url +
                ", dead=" + dead +
                ", failures=" + failures +
                '}';
    }
}
