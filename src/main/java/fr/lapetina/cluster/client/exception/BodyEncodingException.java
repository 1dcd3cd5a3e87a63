package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * The request body could not be serialized. No node was contacted.
 */
public final class BodyEncodingException extends ClusterClientException {

    public BodyEncodingException(Object body, Throwable cause) {
        super(ErrorType.ENCODING_ERROR,
                "Failed to encode request body of type " + body.getClass().getName() + ": " + cause.getMessage(),
                cause);
    }
}
