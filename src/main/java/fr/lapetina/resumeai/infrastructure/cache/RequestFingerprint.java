package fr.lapetina.resumeai.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.resumeai.domain.model.AiRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable cache key for the semantic content of a request.
 *
 * SHA-256 over {@code kind:prompt:context}, with the context rendered as JSON with
 * sorted map keys. Request ID, owner, priority and timestamps do not contribute.
 */
public final class RequestFingerprint {

    public static final String KEY_PREFIX = "ai_response";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private RequestFingerprint() {
        // Utility class
    }

    public static String of(AiRequest request) {
        String canonicalContext;
        try {
            canonicalContext = CANONICAL_MAPPER.writeValueAsString(request.context());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request context is not serializable: " + e.getOriginalMessage(), e);
        }
        String material = request.kind().name() + ":" + request.prompt() + ":" + canonicalContext;
        return sha256Hex(material);
    }

    /**
     * Key under which the response for this request is cached.
     */
    public static String cacheKey(AiRequest request) {
        return CacheManager.key(KEY_PREFIX, of(request));
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
