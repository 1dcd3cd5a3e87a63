package fr.lapetina.cluster.client.infrastructure.discovery;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.cluster.client.domain.pool.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts node endpoints from a nodes-info document ({@code GET /_nodes/http}).
 *
 * Each entry of the {@code nodes} object contributes one connection built
 * from {@code http.publish_address}, or from the legacy top-level
 * {@code http_address}. Nodes without an HTTP address are skipped.
 */
public final class NodesInfoParser {

    private static final Logger log = LoggerFactory.getLogger(NodesInfoParser.class);

    private final ObjectMapper objectMapper;
    private final String scheme;

    public NodesInfoParser(String scheme) {
        this.scheme = Objects.requireNonNull(scheme, "Scheme is required");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Parses a nodes-info document.
     *
     * @throws IOException if the document is not valid JSON
     */
    public List<Connection> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        List<Connection> connections = new ArrayList<>();
        if (root == null) {
            return connections;
        }
        JsonNode nodes = root.path("nodes");
        if (!nodes.isObject()) {
            return connections;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = nodes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String nodeId = entry.getKey();
            Optional<String> address = httpAddress(entry.getValue());
            if (address.isEmpty()) {
                log.debug("Node has no HTTP address, skipping: nodeId={}", nodeId);
                continue;
            }

            Optional<String> url = toUrl(address.get());
            if (url.isEmpty()) {
                log.warn("Unrecognized node address: nodeId={}, address={}", nodeId, address.get());
                continue;
            }
            try {
                connections.add(Connection.of(nodeId, url.get()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid node URL: nodeId={}, url={}, error={}", nodeId, url.get(), e.getMessage());
            }
        }
        return connections;
    }

    private static Optional<String> httpAddress(JsonNode node) {
        String publish = node.path("http").path("publish_address").asText("");
        if (!publish.isBlank()) {
            return Optional.of(publish);
        }
        String legacy = node.path("http_address").asText("");
        if (!legacy.isBlank()) {
            return Optional.of(legacy);
        }
        return Optional.empty();
    }

    /**
     * Turns a published address into a base URL. Accepts {@code host:port},
     * {@code inet[/ip:port]}, {@code inet[host/ip:port]}, {@code host/ip:port}
     * and {@code [v6]:port}; when a {@code host/ip} pair is given the IP is used.
     */
    Optional<String> toUrl(String address) {
        String value = address.trim();
        if (value.startsWith("inet[") && value.endsWith("]")) {
            value = value.substring("inet[".length(), value.length() - 1);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(slash + 1);
        }

        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            return Optional.empty();
        }
        String host = value.substring(0, colon);
        String port = value.substring(colon + 1);
        if (!port.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        if (host.contains(":") && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return Optional.of(scheme + "://" + host + ":" + port);
    }
}
