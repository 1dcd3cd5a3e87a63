package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * No HTTP response could be obtained from any node within the retry budget.
 * The cause is the failure of the last attempt.
 */
public final class TransportException extends ClusterClientException {

    private final int attempts;

    public TransportException(String url, int attempts, Throwable cause) {
        super(ErrorType.TRANSPORT_ERROR,
                "Request to " + url + " failed after " + attempts + " attempt(s): " + cause.getMessage(),
                cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
