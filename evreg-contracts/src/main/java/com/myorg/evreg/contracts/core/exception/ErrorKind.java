package com.myorg.evreg.contracts.core.exception;

/**
 * Category of a delivery failure. Decides whether the failure is retried locally
 * or handed to dead-letter routing.
 */
public enum ErrorKind {
    /** Network, timeout or broker unavailable. Retried with backoff. */
    TRANSIENT,
    /** Malformed payload, authorization and similar. Retrying cannot help. */
    PERMANENT,
    /** The bulkhead queue is full. */
    RESOURCE_EXHAUSTED,
    /** The circuit breaker rejected the call. */
    CIRCUIT_OPEN,
    /** The caller was interrupted or its deadline passed. */
    CANCELLED,
    /** Neither the dead-letter topic nor the local fallback accepted the message. */
    DEAD_LETTER_FAILURE;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
