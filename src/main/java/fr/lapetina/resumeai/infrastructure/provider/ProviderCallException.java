package fr.lapetina.resumeai.infrastructure.provider;

import java.time.Duration;
import java.util.Optional;

/**
 * Raw failure of a provider call, as reported by the transport.
 *
 * Either an HTTP status with the provider's error message, or a transport-level
 * error code (ECONNREFUSED, ENOTFOUND, ...). No classification happens here.
 */
public final class ProviderCallException extends RuntimeException {

    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String ENOTFOUND = "ENOTFOUND";
    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String ECONNRESET = "ECONNRESET";

    private final String provider;
    private final int statusCode;
    private final String transportCode;
    private final Duration retryAfter;

    private ProviderCallException(
            String provider,
            int statusCode,
            String transportCode,
            Duration retryAfter,
            String message,
            Throwable cause
    ) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.transportCode = transportCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Failure signalled by an HTTP status.
     *
     * @param retryAfter value of the Retry-After header, may be null
     */
    public static ProviderCallException httpStatus(String provider, int statusCode, String message, Duration retryAfter) {
        return new ProviderCallException(provider, statusCode, null, retryAfter,
                message != null ? message : "HTTP " + statusCode, null);
    }

    public static ProviderCallException httpStatus(String provider, int statusCode, String message) {
        return httpStatus(provider, statusCode, message, null);
    }

    /**
     * Failure before any HTTP status was received.
     */
    public static ProviderCallException transport(String provider, String transportCode, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new ProviderCallException(provider, -1, transportCode, null,
                "Network error connecting to " + provider + " (" + transportCode + ")" + detail, cause);
    }

    public String getProvider() {
        return provider;
    }

    public boolean hasStatus() {
        return statusCode > 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Optional<String> getTransportCode() {
        return Optional.ofNullable(transportCode);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
