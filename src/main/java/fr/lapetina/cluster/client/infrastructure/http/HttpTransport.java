package fr.lapetina.cluster.client.infrastructure.http;

import fr.lapetina.cluster.client.domain.model.ClusterResponse;

import java.net.http.HttpRequest;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one HTTP exchange to one node.
 *
 * The returned future completes with the node's response whatever its status,
 * or exceptionally when no response could be obtained. Cancelling the future
 * must abort the exchange and release its connection.
 */
public interface HttpTransport extends AutoCloseable {

    CompletableFuture<ClusterResponse> send(HttpRequest request);

    @Override
    default void close() {
        // Nothing to release by default
    }
}
