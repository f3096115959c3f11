package fr.lapetina.resumeai.infrastructure.cache;

import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.Priority;
import fr.lapetina.resumeai.domain.model.RequestKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprintTest {

    private static AiRequest.Builder analysis(Map<String, Object> context) {
        return AiRequest.builder()
                .kind(RequestKind.ANALYSIS)
                .prompt("Score this resume for a backend role")
                .context(context);
    }

    @Test
    @DisplayName("should ignore request ID, owner and priority")
    void shouldIgnoreNonSemanticFields() {
        AiRequest first = analysis(Map.of("resumeId", "r-1")).id("a").ownerId("user-1").priority(Priority.HIGH).build();
        AiRequest second = analysis(Map.of("resumeId", "r-1")).id("b").ownerId("user-2").priority(Priority.LOW).build();

        assertThat(RequestFingerprint.of(first)).isEqualTo(RequestFingerprint.of(second));
    }

    @Test
    @DisplayName("should not depend on context key order")
    void shouldIgnoreContextKeyOrder() {
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("jobTitle", "Engineer");
        ordered.put("industry", "Fintech");
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("industry", "Fintech");
        reversed.put("jobTitle", "Engineer");

        assertThat(RequestFingerprint.of(analysis(ordered).ownerId("u").build()))
                .isEqualTo(RequestFingerprint.of(analysis(reversed).ownerId("u").build()));
    }

    @Test
    @DisplayName("should differ by kind, prompt or context")
    void shouldDifferBySemanticFields() {
        AiRequest base = analysis(Map.of("resumeId", "r-1")).ownerId("u").build();
        AiRequest otherKind = analysis(Map.of("resumeId", "r-1")).ownerId("u").kind(RequestKind.COMPARISON).build();
        AiRequest otherPrompt = analysis(Map.of("resumeId", "r-1")).ownerId("u").prompt("Another prompt").build();
        AiRequest otherContext = analysis(Map.of("resumeId", "r-2")).ownerId("u").build();

        String fingerprint = RequestFingerprint.of(base);
        assertThat(RequestFingerprint.of(otherKind)).isNotEqualTo(fingerprint);
        assertThat(RequestFingerprint.of(otherPrompt)).isNotEqualTo(fingerprint);
        assertThat(RequestFingerprint.of(otherContext)).isNotEqualTo(fingerprint);
    }

    @Test
    @DisplayName("should produce a prefixed SHA-256 cache key")
    void shouldBuildCacheKey() {
        AiRequest request = analysis(Map.of()).ownerId("u").build();

        String key = RequestFingerprint.cacheKey(request);

        assertThat(key).startsWith(RequestFingerprint.KEY_PREFIX + ":");
        assertThat(key.substring(RequestFingerprint.KEY_PREFIX.length() + 1)).matches("[0-9a-f]{64}");
    }
}
