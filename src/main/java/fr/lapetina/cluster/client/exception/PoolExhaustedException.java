package fr.lapetina.cluster.client.exception;

import fr.lapetina.cluster.client.domain.model.ErrorType;

/**
 * Thrown by the connection pool when every connection is dead.
 * The pool has resurrected all connections by the time this is thrown,
 * so the next call proceeds normally.
 */
public final class PoolExhaustedException extends ClusterClientException {

    private final int poolSize;

    public PoolExhaustedException(int poolSize) {
        super(ErrorType.POOL_EXHAUSTED,
                "No live connection: all " + poolSize + " connections were dead and have been resurrected");
        this.poolSize = poolSize;
    }

    public int getPoolSize() {
        return poolSize;
    }
}
