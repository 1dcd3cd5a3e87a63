package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * Base class for every failure surfaced by the cluster client.
 *
 * The {@link ErrorType} tells callers (and metrics) which recovery applies:
 * construction failures are fatal, pool exhaustion is transient for one call,
 * HTTP errors carry the node's response.
 */
public class ClusterClientException extends RuntimeException {

    private final ErrorType errorType;

    public ClusterClientException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ClusterClientException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
