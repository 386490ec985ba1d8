package com.production.pdf_analysis.exception;

/**
 * Outcome class of a single provider call; decides retry vs. failover in the router.
 */
public enum ProviderFailureKind {
    /** Bad or missing credential. Never retried. */
    AUTHENTICATION,
    /** Rate limit, overload, connection error or deadline overrun. Retried with backoff. */
    TRANSIENT,
    /** The call succeeded but returned no usable content. */
    EMPTY_RESPONSE,
    OTHER;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
