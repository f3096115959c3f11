package fr.lapetina.resumeai.admission;

import fr.lapetina.resumeai.domain.model.ClassifiedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-owner request limits over fixed minute and hour windows.
 *
 * Windows are aligned on clock boundaries (the minute starting at :00, the hour starting
 * at hh:00). A request counts against both windows once admitted; a refused request
 * counts against neither. Each owner's counters are replaced atomically through
 * {@link ConcurrentHashMap#compute}, so concurrent submissions never overshoot.
 */
public final class OwnerRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(OwnerRateLimiter.class);

    public static final Duration MINUTE = Duration.ofMinutes(1);
    public static final Duration HOUR = Duration.ofHours(1);

    private final boolean enabled;
    private final int requestsPerMinute;
    private final int requestsPerHour;
    private final Clock clock;
    private final ConcurrentHashMap<String, OwnerCounts> owners = new ConcurrentHashMap<>();

    public OwnerRateLimiter(int requestsPerMinute, int requestsPerHour, Clock clock) {
        this(true, requestsPerMinute, requestsPerHour, clock);
    }

    private OwnerRateLimiter(boolean enabled, int requestsPerMinute, int requestsPerHour, Clock clock) {
        if (enabled && (requestsPerMinute <= 0 || requestsPerHour <= 0)) {
            throw new IllegalArgumentException("Owner limits must be positive: requestsPerMinute="
                    + requestsPerMinute + ", requestsPerHour=" + requestsPerHour);
        }
        this.enabled = enabled;
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerHour = requestsPerHour;
        this.clock = clock;
    }

    /**
     * Limiter that admits everything and tracks nothing.
     */
    public static OwnerRateLimiter disabled(Clock clock) {
        return new OwnerRateLimiter(false, Integer.MAX_VALUE, Integer.MAX_VALUE, clock);
    }

    /**
     * Counts one request for the owner unless a window is exhausted.
     *
     * @return empty when admitted, otherwise the RATE_LIMIT_EXCEEDED error with the reset of the exhausted window
     */
    public Optional<ClassifiedError> tryAcquire(String ownerId, String requestId) {
        if (!enabled) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        long minute = bucket(now, MINUTE);
        long hour = bucket(now, HOUR);
        ClassifiedError[] rejection = new ClassifiedError[1];

        owners.compute(ownerId, (id, counts) -> {
            OwnerCounts current = OwnerCounts.rolled(counts, minute, hour);
            if (current.minuteCount() >= requestsPerMinute) {
                rejection[0] = ClassifiedError.rateLimited(null, requestId,
                        "Rate limit exceeded: too many requests per minute", boundary(minute + 1, MINUTE), now);
                return current;
            }
            if (current.hourCount() >= requestsPerHour) {
                rejection[0] = ClassifiedError.rateLimited(null, requestId,
                        "Rate limit exceeded: too many requests per hour", boundary(hour + 1, HOUR), now);
                return current;
            }
            return current.increment();
        });

        if (rejection[0] != null) {
            log.warn("Owner rate limited: ownerId={}, requestId={}, resetAt={}, reason={}",
                    ownerId, requestId, rejection[0].resetAt(), rejection[0].message());
        }
        return Optional.ofNullable(rejection[0]);
    }

    public OwnerRateLimitStatus status(String ownerId) {
        Instant now = clock.instant();
        long minute = bucket(now, MINUTE);
        long hour = bucket(now, HOUR);
        if (!enabled) {
            return new OwnerRateLimitStatus(ownerId, Integer.MAX_VALUE, Integer.MAX_VALUE,
                    boundary(minute + 1, MINUTE), false);
        }

        OwnerCounts counts = OwnerCounts.rolled(owners.get(ownerId), minute, hour);
        int minuteRemaining = Math.max(0, requestsPerMinute - counts.minuteCount());
        int hourRemaining = Math.max(0, requestsPerHour - counts.hourCount());
        Instant resetTime = hourRemaining == 0 ? boundary(hour + 1, HOUR) : boundary(minute + 1, MINUTE);
        return new OwnerRateLimitStatus(ownerId, minuteRemaining, hourRemaining, resetTime,
                minuteRemaining == 0 || hourRemaining == 0);
    }

    /**
     * Forgets owners with no request in the current hour.
     *
     * @return number of owners removed
     */
    public int evictIdle() {
        if (!enabled) {
            return 0;
        }
        long hour = bucket(clock.instant(), HOUR);
        int before = owners.size();
        owners.entrySet().removeIf(e -> e.getValue().hourBucket() < hour);
        int removed = Math.max(0, before - owners.size());
        if (removed > 0) {
            log.debug("Idle owners evicted: removed={}, remaining={}", removed, owners.size());
        }
        return removed;
    }

    public int trackedOwners() {
        return owners.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public int getRequestsPerHour() {
        return requestsPerHour;
    }

    private static long bucket(Instant now, Duration window) {
        return Math.floorDiv(now.toEpochMilli(), window.toMillis());
    }

    private static Instant boundary(long bucket, Duration window) {
        return Instant.ofEpochMilli(bucket * window.toMillis());
    }

    /**
     * Immutable counters; replaced on every change so removal by value stays safe.
     */
    private record OwnerCounts(long minuteBucket, int minuteCount, long hourBucket, int hourCount) {

        static OwnerCounts rolled(OwnerCounts counts, long minute, long hour) {
            if (counts == null) {
                return new OwnerCounts(minute, 0, hour, 0);
            }
            return new OwnerCounts(
                    minute,
                    counts.minuteBucket == minute ? counts.minuteCount : 0,
                    hour,
                    counts.hourBucket == hour ? counts.hourCount : 0);
        }

        OwnerCounts increment() {
            return new OwnerCounts(minuteBucket, minuteCount + 1, hourBucket, hourCount + 1);
        }
    }
}
