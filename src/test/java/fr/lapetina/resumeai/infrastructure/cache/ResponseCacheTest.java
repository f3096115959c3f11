package fr.lapetina.resumeai.infrastructure.cache;

import fr.lapetina.resumeai.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new ResponseCache<>("test", 3, Duration.ofMinutes(10), Duration.ofMinutes(1), clock);
    }

    @Test
    @DisplayName("should return stored values until their TTL elapses")
    void shouldExpireAfterTtl() {
        cache.set("a", "alpha");

        clock.advance(Duration.ofMinutes(10).minusMillis(1));
        assertThat(cache.get("a")).contains("alpha");

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should honor a per-entry TTL")
    void shouldHonorCustomTtl() {
        cache.set("short", "value", Duration.ofSeconds(5));
        cache.set("long", "value");

        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.has("short")).isFalse();
        assertThat(cache.has("long")).isTrue();
    }

    @Test
    @DisplayName("should evict the oldest entries beyond max size")
    void shouldEvictOldest() {
        cache.set("a", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.set("b", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.set("c", "3");
        clock.advance(Duration.ofSeconds(1));
        cache.set("d", "4");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.keys()).containsExactly("b", "c", "d");
    }

    @Test
    @DisplayName("should treat an overwritten entry as newest")
    void shouldRefreshOnOverwrite() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        cache.set("a", "1-bis");
        cache.set("d", "4");

        assertThat(cache.keys()).containsExactly("c", "a", "d");
        assertThat(cache.get("a")).contains("1-bis");
    }

    @Test
    @DisplayName("should drop expired entries before evicting live ones")
    void shouldCleanupExpiredFirst() {
        cache.set("stale", "x", Duration.ofSeconds(1));
        cache.set("b", "2");
        cache.set("c", "3");
        clock.advance(Duration.ofSeconds(2));

        cache.set("d", "4");

        assertThat(cache.keys()).containsExactly("b", "c", "d");
    }

    @Test
    @DisplayName("should delete by key and by prefix")
    void shouldDelete() {
        cache.set("user_context:1", "ctx");
        cache.set("user_preferences:1", "prefs");
        cache.set("other", "x");

        assertThat(cache.delete("other")).isTrue();
        assertThat(cache.delete("other")).isFalse();
        assertThat(cache.deleteByPrefix("user_")).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should count hits and misses and reset them on clear")
    void shouldTrackStats() {
        cache.set("a", "1");
        cache.get("a");
        cache.get("a");
        cache.get("missing");

        CacheStats stats = cache.getStats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(2.0 / 3);
        assertThat(stats.maxSize()).isEqualTo(3);

        cache.clear();
        assertThat(cache.getStats().hits()).isZero();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should report removed count from cleanup")
    void shouldReportCleanupCount() {
        cache.set("a", "1", Duration.ofSeconds(1));
        cache.set("b", "2", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(1));

        assertThat(cache.cleanup()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a non-positive max size")
    void shouldRejectInvalidMaxSize() {
        assertThatThrownBy(() -> new ResponseCache<String>("bad", 0, Duration.ofMinutes(1), Duration.ofMinutes(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
