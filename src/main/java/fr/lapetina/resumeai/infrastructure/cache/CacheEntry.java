package fr.lapetina.resumeai.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with its write time and time-to-live.
 */
public record CacheEntry<T>(String key, T data, Instant writtenAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(writtenAt, "Write time is required");
        Objects.requireNonNull(ttl, "TTL is required");
    }

    /**
     * Valid while {@code now - writtenAt < ttl}.
     */
    public boolean isValidAt(Instant now) {
        return Duration.between(writtenAt, now).compareTo(ttl) < 0;
    }
}
