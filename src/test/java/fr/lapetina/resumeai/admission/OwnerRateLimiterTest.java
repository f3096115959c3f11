package fr.lapetina.resumeai.admission;

import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnerRateLimiterTest {

    private MutableClock clock;
    private OwnerRateLimiter limiter;

    @BeforeEach
    void setUp() {
        // 10:00:30, mid-minute
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:30Z"));
        limiter = new OwnerRateLimiter(3, 5, clock);
    }

    @Test
    @DisplayName("should reset the minute budget on the next minute boundary")
    void shouldResetOnMinuteBoundary() {
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire("user-1", "req-" + i)).isEmpty();
        }

        Optional<ClassifiedError> rejected = limiter.tryAcquire("user-1", "req-3");

        assertThat(rejected).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
            assertThat(error.requestId()).isEqualTo("req-3");
            assertThat(error.provider()).isNull();
            assertThat(error.resetAt()).isEqualTo(Instant.parse("2024-01-15T10:01:00Z"));
            assertThat(error.message()).isEqualTo("Rate limit exceeded: too many requests per minute");
        });

        clock.advance(Duration.ofSeconds(29));
        assertThat(limiter.tryAcquire("user-1", "req-4")).isPresent();
        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.tryAcquire("user-1", "req-5")).isEmpty();
    }

    @Test
    @DisplayName("should not count refused requests")
    void shouldNotCountRefusals() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("user-1", "req-" + i);
        }
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAcquire("user-1", "refused-" + i)).isPresent();
        }

        clock.advance(Duration.ofMinutes(1));

        assertThat(limiter.status("user-1").requestsRemainingThisHour()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject on the hour budget once minutes no longer bind")
    void shouldRejectOnHourBudget() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("user-1", "a-" + i);
        }
        clock.advance(Duration.ofMinutes(1));
        limiter.tryAcquire("user-1", "b-0");
        limiter.tryAcquire("user-1", "b-1");

        Optional<ClassifiedError> rejected = limiter.tryAcquire("user-1", "b-2");

        assertThat(rejected).hasValueSatisfying(error -> {
            assertThat(error.resetAt()).isEqualTo(Instant.parse("2024-01-15T11:00:00Z"));
            assertThat(error.message()).isEqualTo("Rate limit exceeded: too many requests per hour");
        });
        OwnerRateLimitStatus status = limiter.status("user-1");
        assertThat(status.requestsRemaining()).isEqualTo(1);
        assertThat(status.requestsRemainingThisHour()).isZero();
        assertThat(status.limited()).isTrue();
        assertThat(status.resetTime()).isEqualTo(Instant.parse("2024-01-15T11:00:00Z"));
    }

    @Test
    @DisplayName("should keep owners independent")
    void shouldKeepOwnersIndependent() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire("user-1", "req-" + i);
        }

        assertThat(limiter.tryAcquire("user-2", "other")).isEmpty();
        assertThat(limiter.status("user-2").requestsRemaining()).isEqualTo(2);
        assertThat(limiter.status("unknown")).satisfies(status -> {
            assertThat(status.requestsRemaining()).isEqualTo(3);
            assertThat(status.requestsRemainingThisHour()).isEqualTo(5);
            assertThat(status.limited()).isFalse();
            assertThat(status.resetTime()).isEqualTo(Instant.parse("2024-01-15T10:01:00Z"));
        });
    }

    @Test
    @DisplayName("should forget owners idle since a previous hour")
    void shouldEvictIdleOwners() {
        limiter.tryAcquire("user-1", "req-0");
        clock.advance(Duration.ofMinutes(45));
        limiter.tryAcquire("user-2", "req-1");
        assertThat(limiter.evictIdle()).isZero();

        clock.advance(Duration.ofMinutes(20));

        assertThat(limiter.evictIdle()).isEqualTo(2);
        assertThat(limiter.trackedOwners()).isZero();
    }

    @Test
    @DisplayName("should admit exactly the minute budget under concurrent submissions")
    void shouldNotOvershootUnderContention() throws Exception {
        OwnerRateLimiter shared = new OwnerRateLimiter(25, 1000, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int worker = t;
                tasks.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 20; i++) {
                        if (shared.tryAcquire("user-1", "w" + worker + "-" + i).isEmpty()) {
                            admitted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(25);
        assertThat(shared.status("user-1").requestsRemaining()).isZero();
    }

    @Test
    @DisplayName("should admit everything when disabled")
    void shouldAdmitWhenDisabled() {
        OwnerRateLimiter disabled = OwnerRateLimiter.disabled(clock);

        for (int i = 0; i < 100; i++) {
            assertThat(disabled.tryAcquire("user-1", "req-" + i)).isEmpty();
        }
        assertThat(disabled.trackedOwners()).isZero();
        assertThat(disabled.status("user-1").limited()).isFalse();
    }

    @Test
    @DisplayName("should reject non-positive limits")
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> new OwnerRateLimiter(0, 10, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
