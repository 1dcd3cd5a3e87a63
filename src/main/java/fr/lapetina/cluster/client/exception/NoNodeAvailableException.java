package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * Thrown when no node of the cluster could be reached during startup
 * discovery or the startup health check. The client is unusable.
 */
public final class NoNodeAvailableException extends ClusterClientException {

    public NoNodeAvailableException(String details) {
        super(ErrorType.NO_NODE_AVAILABLE, "No cluster node available: " + details);
    }
}
