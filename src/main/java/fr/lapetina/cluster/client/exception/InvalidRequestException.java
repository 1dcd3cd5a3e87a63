package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * The request cannot be turned into a URI. No node was contacted.
 */
public final class InvalidRequestException extends ClusterClientException {

    public InvalidRequestException(String method, String path, Throwable cause) {
        super(ErrorType.INVALID_REQUEST, "Invalid request target for " + method + " " + path + ": " + cause.getMessage(),
                cause);
    }
}
