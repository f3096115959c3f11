package fr.lapetina.resumeai.admission;

import java.time.Instant;

/**
 * Rate-limit window of one provider at a point in time.
 *
 * @param requestsRemaining requests still admissible in the current window
 * @param resetTime         when the current window ends
 * @param limited           true when no further request can be admitted right now
 */
public record RateLimitStatus(
        String provider,
        int requestsRemaining,
        int activeConcurrent,
        Instant resetTime,
        boolean limited
) {
}
