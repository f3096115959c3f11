package fr.lapetina.resumeai.domain.model;

/**
 * Error taxonomy for AI requests.
 * Each code carries its retryability verdict and the HTTP status a route handler answers with.
 */
public enum ErrorCode {
    /** Provider answered 429 */
    RATE_LIMIT_EXCEEDED(true, 429),

    /** Credential misconfiguration (401) */
    AUTHENTICATION_ERROR(false, 401),

    /** Plan or usage limit reached (403) */
    QUOTA_EXCEEDED(false, 402),

    /** Malformed request, never retried */
    INVALID_REQUEST(false, 400),

    /** Provider 5xx, network failure or call timeout */
    PROVIDER_UNAVAILABLE(true, 503),

    /** Unrecognized failure, treated as transient */
    UNKNOWN_ERROR(true, 500),

    /** Admission rejected the request: provider queue at capacity */
    QUEUE_FULL(true, 503),

    /** Request waited in the queue longer than allowed */
    QUEUE_TIMEOUT(true, 504);

    private final boolean retryable;
    private final int httpStatus;

    ErrorCode(boolean retryable, int httpStatus) {
        this.retryable = retryable;
        this.httpStatus = httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Codes meaning the provider cannot serve this request at all, so the next provider is tried.
     */
    public boolean isProviderLevel() {
        return this == PROVIDER_UNAVAILABLE || this == QUOTA_EXCEEDED;
    }
}
