package fr.lapetina.resumeai.resilience;

import java.time.Instant;
import java.util.Optional;

/**
 * Rate-limit permits for providers reached through fallback.
 *
 * The admission provider's slot is reserved before dispatch; attempts on any other
 * provider take a permit from that provider's window here and give it back when the
 * controller moves on or finishes.
 */
public interface ProviderPermits {

    /**
     * Permits that are always granted.
     */
    ProviderPermits UNLIMITED = new ProviderPermits() {
        @Override
        public boolean tryAcquire(String provider) {
            return true;
        }

        @Override
        public void release(String provider) {
            // Nothing held
        }

        @Override
        public Optional<Instant> resetAt(String provider) {
            return Optional.empty();
        }
    };

    /**
     * Takes a concurrency slot and one request from the provider's window, without blocking.
     *
     * @return false when the provider is at its concurrency or per-minute limit
     */
    boolean tryAcquire(String provider);

    void release(String provider);

    /**
     * When the provider's current window resets, if the provider is rate limited.
     */
    Optional<Instant> resetAt(String provider);
}
