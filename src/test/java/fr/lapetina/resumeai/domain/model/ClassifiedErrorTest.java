package fr.lapetina.resumeai.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifiedErrorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @ParameterizedTest
    @EnumSource(ErrorCode.class)
    @DisplayName("should take retryability from the code")
    void shouldTakeRetryabilityFromCode(ErrorCode code) {
        ClassifiedError error = ClassifiedError.of(code, "openai", "req-1", "boom", NOW);

        assertThat(error.retryable()).isEqualTo(code.isRetryable());
        assertThat(error.getResetAt()).isEmpty();
    }

    @Test
    @DisplayName("should only carry a reset time for rate limits")
    void shouldRestrictResetTime() {
        assertThatThrownBy(() -> new ClassifiedError(ErrorCode.QUEUE_FULL, true, null, "req-1", "full",
                NOW.plusSeconds(5), NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("QUEUE_FULL");
    }

    @Test
    @DisplayName("should round retry-after up to whole seconds")
    void shouldComputeRetryAfter() {
        ClassifiedError error = ClassifiedError.rateLimited("anthropic", "req-1", "slow down",
                NOW.plusMillis(12_300), NOW);

        assertThat(error.retryable()).isTrue();
        assertThat(error.retryAfterSeconds(NOW)).contains(13L);
        assertThat(error.retryAfterSeconds(NOW.plusSeconds(60))).contains(0L);
    }

    @Test
    @DisplayName("should map codes to HTTP statuses")
    void shouldMapHttpStatuses() {
        assertThat(ErrorCode.RATE_LIMIT_EXCEEDED.getHttpStatus()).isEqualTo(429);
        assertThat(ErrorCode.AUTHENTICATION_ERROR.getHttpStatus()).isEqualTo(401);
        assertThat(ErrorCode.QUOTA_EXCEEDED.getHttpStatus()).isEqualTo(402);
        assertThat(ErrorCode.QUEUE_TIMEOUT.getHttpStatus()).isEqualTo(504);
        assertThat(ErrorCode.QUOTA_EXCEEDED.isProviderLevel()).isTrue();
        assertThat(ErrorCode.RATE_LIMIT_EXCEEDED.isProviderLevel()).isFalse();
    }
}
