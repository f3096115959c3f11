package fr.lapetina.resumeai.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed 60-second rate-limit window and concurrency counter for one provider.
 *
 * Invariants: {@code 0 <= activeConcurrent <= concurrencyLimit} and
 * {@code 0 <= requestsThisWindow <= requestsPerMinute}. Every read-modify-write is
 * synchronized so permits taken from different threads never overshoot.
 */
public final class RateLimitWindow {

    private static final Logger log = LoggerFactory.getLogger(RateLimitWindow.class);

    public static final Duration WINDOW = Duration.ofSeconds(60);

    private final String provider;
    private final int requestsPerMinute;
    private final int concurrencyLimit;
    private final Clock clock;

    private Instant windowStart;
    private int requestsThisWindow;
    private int activeConcurrent;

    public RateLimitWindow(String provider, int requestsPerMinute, int concurrencyLimit, Clock clock) {
        if (requestsPerMinute <= 0 || concurrencyLimit <= 0) {
            throw new IllegalArgumentException("Limits must be positive for provider " + provider
                    + ": requestsPerMinute=" + requestsPerMinute + ", concurrencyLimit=" + concurrencyLimit);
        }
        this.provider = provider;
        this.requestsPerMinute = requestsPerMinute;
        this.concurrencyLimit = concurrencyLimit;
        this.clock = clock;
        this.windowStart = clock.instant();
    }

    /**
     * Reserves one concurrency slot and one request of the current window.
     *
     * @return false, reserving nothing, when either limit is reached
     */
    public synchronized boolean tryAcquire() {
        roll(clock.instant());
        if (activeConcurrent >= concurrencyLimit || requestsThisWindow >= requestsPerMinute) {
            return false;
        }
        activeConcurrent++;
        requestsThisWindow++;
        return true;
    }

    /**
     * Frees a concurrency slot. The window's request count is not given back.
     */
    public synchronized void release() {
        if (activeConcurrent == 0) {
            log.warn("Release without matching acquire: provider={}", provider);
            return;
        }
        activeConcurrent--;
    }

    public synchronized boolean isLimited() {
        roll(clock.instant());
        return activeConcurrent >= concurrencyLimit || requestsThisWindow >= requestsPerMinute;
    }

    public synchronized Instant resetAt() {
        roll(clock.instant());
        return windowStart.plus(WINDOW);
    }

    public synchronized int getActiveConcurrent() {
        return activeConcurrent;
    }

    public synchronized int getRequestsThisWindow() {
        roll(clock.instant());
        return requestsThisWindow;
    }

    public synchronized RateLimitStatus snapshot() {
        roll(clock.instant());
        return new RateLimitStatus(
                provider,
                requestsPerMinute - requestsThisWindow,
                activeConcurrent,
                windowStart.plus(WINDOW),
                activeConcurrent >= concurrencyLimit || requestsThisWindow >= requestsPerMinute
        );
    }

    /**
     * Starts a fresh window; in-flight slots stay held.
     */
    public synchronized void resetWindow() {
        windowStart = clock.instant();
        requestsThisWindow = 0;
    }

    private void roll(Instant now) {
        if (Duration.between(windowStart, now).compareTo(WINDOW) >= 0) {
            windowStart = now;
            requestsThisWindow = 0;
        }
    }

    public String getProvider() {
        return provider;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    @Override
    public synchronized String toString() {
        return "RateLimitWindow{provider=" + provider
                + ", requests=" + requestsThisWindow + "/" + requestsPerMinute
                + ", active=" + activeConcurrent + "/" + concurrencyLimit
                + ", windowStart=" + windowStart + '}';
    }
}
