package com.riftinsight.infrastructure.riot;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one gateway operation: the value was found, the upstream reported it
 * absent, or the call failed after the gateway's retry and fallback policy ran out.
 *
 * @param <T> value type
 */
public final class UpstreamResult<T> {

    public enum Status {
        FOUND,
        ABSENT,
        FAILED
    }

    private final Status status;
    private final T value;
    private final UpstreamFailureKind failureKind;
    private final String message;

    private UpstreamResult(Status status, T value, UpstreamFailureKind failureKind, String message) {
        this.status = status;
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static <T> UpstreamResult<T> found(T value) {
        return new UpstreamResult<>(Status.FOUND, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> UpstreamResult<T> absent() {
        return new UpstreamResult<>(Status.ABSENT, null, null, null);
    }

    public static <T> UpstreamResult<T> failed(UpstreamFailureKind kind, String message) {
        return new UpstreamResult<>(Status.FAILED, null, kind, message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public UpstreamFailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Found value, or empty for both absent and failed results.
     */
    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isFound() ? value : fallback;
    }

    /**
     * Found value; absence maps to empty, failure is raised as {@link UpstreamException}.
     * Used by load-bearing phases where a failed lookup must end the analysis.
     */
    public Optional<T> orElseThrowFailure() {
        if (isFailed()) {
            throw new UpstreamException(failureKind, message);
        }
        return toOptional();
    }

    public <R> UpstreamResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isFound()) {
            return new UpstreamResult<>(status, null, failureKind, message);
        }
        return found(mapper.apply(value));
    }

    @Override
    public String toString() {
        return switch (status) {
            case FOUND -> "Found(" + value.getClass().getSimpleName() + ")";
            case ABSENT -> "Absent";
            case FAILED -> "Failed(" + failureKind + ": " + message + ")";
        };
    }
}
