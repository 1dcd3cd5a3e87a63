package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * A node answered with a non-success status. The request is not retried;
 * the response is attached so the caller can inspect status and body.
 */
public final class ResponseStatusException extends ClusterClientException {

    private final transient ClusterResponse response;

    public ResponseStatusException(ClusterResponse response, String reason) {
        super(ErrorType.HTTP_ERROR, "HTTP " + response.statusCode() + ": " + reason);
        this.response = response;
    }

    public ClusterResponse getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.statusCode();
    }
}
