package fr.lapetina.resumeai.resilience;

import java.time.Duration;

/**
 * Exponential backoff between retries of the same provider.
 */
public final class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * {@code baseDelay * 2^attemptIndex}, capped at {@code maxDelay}.
     *
     * @param attemptIndex zero-based index of the failed attempt on this provider
     */
    public Duration delayFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must not be negative: " + attemptIndex);
        }
        // 2^30 already exceeds any sensible cap; avoids overflow
        int exponent = Math.min(attemptIndex, 30);
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), 1L << exponent);
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
