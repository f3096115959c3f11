package fr.lapetina.resumeai.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Successful completion returned by a provider.
 * Immutable and thread-safe.
 *
 * @param attempts number of provider attempts made before this response, 0 when served from cache
 */
public record AiResponse(
        String id,
        String requestId,
        String content,
        String provider,
        String model,
        TokenUsage usage,
        Instant timestamp,
        Duration processingTime,
        int attempts,
        boolean cached
) {
    public AiResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(provider, "Provider is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (usage == null) {
            usage = TokenUsage.EMPTY;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (processingTime == null) {
            processingTime = Duration.ZERO;
        }
    }

    /**
     * Creates a response as returned by a provider, before the controller stamps attempts.
     */
    public static AiResponse of(String requestId, String provider, String model, String content, TokenUsage usage) {
        return new AiResponse(null, requestId, content, provider, model, usage, null, null, 0, false);
    }

    public AiResponse withAttempts(int attempts, Duration processingTime) {
        return new AiResponse(id, requestId, content, provider, model, usage, timestamp,
                processingTime, attempts, cached);
    }

    /**
     * Copy served from cache for another request with the same fingerprint.
     */
    public AiResponse asCachedFor(String otherRequestId) {
        return new AiResponse(id, otherRequestId, content, provider, model, usage, timestamp,
                Duration.ZERO, 0, true);
    }
}
