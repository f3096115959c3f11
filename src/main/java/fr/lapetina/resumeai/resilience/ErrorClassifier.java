package fr.lapetina.resumeai.resilience;

import fr.lapetina.resumeai.domain.exception.AiServiceException;
import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.infrastructure.provider.ProviderCallException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw provider failures to the error taxonomy.
 *
 * <table>
 *   <tr><th>Raw failure</th><th>Code</th></tr>
 *   <tr><td>HTTP 429</td><td>RATE_LIMIT_EXCEEDED, reset after Retry-After (default 60s, at most 24h)</td></tr>
 *   <tr><td>HTTP 401</td><td>AUTHENTICATION_ERROR</td></tr>
 *   <tr><td>HTTP 403</td><td>QUOTA_EXCEEDED</td></tr>
 *   <tr><td>other HTTP 4xx</td><td>INVALID_REQUEST</td></tr>
 *   <tr><td>HTTP 5xx, transport error, I/O failure, timeout</td><td>PROVIDER_UNAVAILABLE</td></tr>
 *   <tr><td>anything else</td><td>UNKNOWN_ERROR</td></tr>
 * </table>
 *
 * The code and retryability depend only on the failure; the clock only stamps times.
 */
public final class ErrorClassifier {

    static final Duration DEFAULT_RATE_LIMIT_RESET = Duration.ofSeconds(60);
    static final Duration MAX_RATE_LIMIT_RESET = Duration.ofHours(24);

    private final Clock clock;

    public ErrorClassifier(Clock clock) {
        this.clock = clock;
    }

    public ErrorClassifier() {
        this(Clock.systemUTC());
    }

    public ClassifiedError classify(Throwable raw, String provider, String requestId) {
        Throwable error = unwrap(raw);
        Instant now = clock.instant();

        if (error instanceof AiServiceException ase) {
            return ase.getError();
        }

        if (error instanceof ProviderCallException pce) {
            if (pce.hasStatus()) {
                return classifyStatus(pce, provider, requestId, now);
            }
            return ClassifiedError.of(ErrorCode.PROVIDER_UNAVAILABLE, provider, requestId,
                    pce.getMessage(), now);
        }

        if (error instanceof TimeoutException) {
            return ClassifiedError.of(ErrorCode.PROVIDER_UNAVAILABLE, provider, requestId,
                    "Request to " + provider + " timed out", now);
        }

        // ConnectException, UnknownHostException and HttpTimeoutException are all IOExceptions
        if (error instanceof IOException) {
            return ClassifiedError.of(ErrorCode.PROVIDER_UNAVAILABLE, provider, requestId,
                    "Network error connecting to " + provider + ": " + error.getMessage(), now);
        }

        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ClassifiedError.of(ErrorCode.UNKNOWN_ERROR, provider, requestId, message, now);
    }

    private ClassifiedError classifyStatus(ProviderCallException pce, String provider, String requestId, Instant now) {
        int status = pce.getStatusCode();
        String message = pce.getMessage();

        if (status == 429) {
            Duration retryAfter = pce.getRetryAfter().orElse(DEFAULT_RATE_LIMIT_RESET);
            if (retryAfter.isNegative()) {
                retryAfter = Duration.ZERO;
            } else if (retryAfter.compareTo(MAX_RATE_LIMIT_RESET) > 0) {
                retryAfter = MAX_RATE_LIMIT_RESET;
            }
            return ClassifiedError.rateLimited(provider, requestId,
                    "Rate limit exceeded for " + provider + ": " + message, now.plus(retryAfter), now);
        }
        if (status == 401) {
            return ClassifiedError.of(ErrorCode.AUTHENTICATION_ERROR, provider, requestId,
                    "Authentication failed for " + provider + ": " + message, now);
        }
        if (status == 403) {
            return ClassifiedError.of(ErrorCode.QUOTA_EXCEEDED, provider, requestId,
                    "Quota exceeded for " + provider + ": " + message, now);
        }
        if (status >= 400 && status < 500) {
            return ClassifiedError.of(ErrorCode.INVALID_REQUEST, provider, requestId, message, now);
        }
        if (status >= 500) {
            return ClassifiedError.of(ErrorCode.PROVIDER_UNAVAILABLE, provider, requestId,
                    provider + " returned HTTP " + status + ": " + message, now);
        }
        return ClassifiedError.of(ErrorCode.UNKNOWN_ERROR, provider, requestId, message, now);
    }

    private static Throwable unwrap(Throwable raw) {
        Throwable current = raw;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
