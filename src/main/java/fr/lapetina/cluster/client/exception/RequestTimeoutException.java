package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

import java.time.Duration;

/**
 * The caller's deadline for a request elapsed. The node that was being
 * contacted is not marked dead.
 */
public final class RequestTimeoutException extends ClusterClientException {

    public RequestTimeoutException(String method, String path, Duration timeout) {
        super(ErrorType.TIMEOUT, method + " " + path + " did not complete within " + timeout);
    }
}
