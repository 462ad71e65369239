package com.riftinsight.infrastructure.riot;

/**
 * Typed failure raised by {@link RiotApiClient} and, for load-bearing lookups,
 * by callers unwrapping an {@link UpstreamResult}.
 */
public class UpstreamException extends RuntimeException {

    private final UpstreamFailureKind kind;
    private final int statusCode;

    public UpstreamException(UpstreamFailureKind kind, String message) {
        this(kind, 0, message, null);
    }

    public UpstreamException(UpstreamFailureKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public UpstreamFailureKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
