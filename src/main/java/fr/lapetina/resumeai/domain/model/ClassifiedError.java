package fr.lapetina.resumeai.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A failure labelled with its taxonomy code.
 * Produced fresh for every failure and never mutated.
 *
 * @param provider  provider that produced the failure, null for admission failures
 * @param resetAt   when the provider rate limit resets; only set for {@link ErrorCode#RATE_LIMIT_EXCEEDED}
 */
public record ClassifiedError(
        ErrorCode code,
        boolean retryable,
        String provider,
        String requestId,
        String message,
        Instant resetAt,
        Instant timestamp
) {
    public ClassifiedError {
        Objects.requireNonNull(code, "Error code is required");
        if (resetAt != null && code != ErrorCode.RATE_LIMIT_EXCEEDED) {
            throw new IllegalArgumentException("resetAt only applies to RATE_LIMIT_EXCEEDED, got " + code);
        }
        if (message == null) {
            message = code.name();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static ClassifiedError of(ErrorCode code, String provider, String requestId, String message, Instant now) {
        return new ClassifiedError(code, code.isRetryable(), provider, requestId, message, null, now);
    }

    public static ClassifiedError rateLimited(String provider, String requestId, String message,
                                              Instant resetAt, Instant now) {
        return new ClassifiedError(ErrorCode.RATE_LIMIT_EXCEEDED, true, provider, requestId,
                message, resetAt, now);
    }

    public static ClassifiedError queueFull(String provider, String requestId, String message, Instant now) {
        return of(ErrorCode.QUEUE_FULL, provider, requestId, message, now);
    }

    public static ClassifiedError queueTimeout(String provider, String requestId, Duration waited, Instant now) {
        return of(ErrorCode.QUEUE_TIMEOUT, provider, requestId,
                "Request waited " + waited.toMillis() + "ms in queue", now);
    }

    public Optional<Instant> getResetAt() {
        return Optional.ofNullable(resetAt);
    }

    public boolean is(ErrorCode other) {
        return code == other;
    }

    /**
     * Seconds a client should wait before resubmitting, when the reset time is known.
     */
    public Optional<Long> retryAfterSeconds(Instant now) {
        return getResetAt().map(reset -> Math.max(0, (long) Math.ceil(
                Duration.between(now, reset).toMillis() / 1000.0)));
    }

    @Override
    public String toString() {
        return code + "{provider=" + provider + ", requestId=" + requestId
                + ", retryable=" + retryable + ", message='" + message + "'"
                + (resetAt != null ? ", resetAt=" + resetAt : "") + "}";
    }
}
