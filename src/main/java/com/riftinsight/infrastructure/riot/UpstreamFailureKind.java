package com.riftinsight.infrastructure.riot;

/**
 * Classification of a failed upstream call.
 *
 * Only rate-limited and transient failures are retried by the gateway's retry policy.
 * Malformed responses get a single uncompressed fallback attempt instead.
 */
public enum UpstreamFailureKind {
    NOT_FOUND(false),
    RATE_LIMITED(true),
    TRANSIENT(true),
    MALFORMED_RESPONSE(false),
    CLIENT_ERROR(false),
    CANCELLED(false);

    private final boolean retryable;

    UpstreamFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
