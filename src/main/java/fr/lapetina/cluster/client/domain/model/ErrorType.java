package fr.lapetina.cluster.client.domain.model;

/**
 * Error taxonomy for cluster requests.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** No node could be reached while the client was being built */
    NO_NODE_AVAILABLE,

    /** Every pooled connection was dead; the pool resurrected them for the next call */
    POOL_EXHAUSTED,

    /** No HTTP response was obtained (refused, reset, DNS, I/O timeout) */
    TRANSPORT_ERROR,

    /** A node answered with a non-success status */
    HTTP_ERROR,

    /** The per-call deadline elapsed */
    TIMEOUT,

    /** The request body could not be serialized */
    ENCODING_ERROR,

    /** The request path or parameters do not form a valid URI */
    INVALID_REQUEST
}
