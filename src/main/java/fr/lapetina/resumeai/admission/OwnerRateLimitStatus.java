package fr.lapetina.resumeai.admission;

import java.time.Instant;

/**
 * Admission budget left to one owner.
 *
 * @param requestsRemaining         requests still admissible in the current minute
 * @param requestsRemainingThisHour requests still admissible in the current hour
 * @param resetTime                 end of the window that currently limits the owner, or of the minute window
 */
public record OwnerRateLimitStatus(
        String ownerId,
        int requestsRemaining,
        int requestsRemainingThisHour,
        Instant resetTime,
        boolean limited
) {
}
