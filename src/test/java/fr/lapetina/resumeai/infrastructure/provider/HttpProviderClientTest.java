package fr.lapetina.resumeai.infrastructure.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import static org.assertj.core.api.Assertions.assertThat;

class HttpProviderClientTest {

    @Test
    @DisplayName("should parse Retry-After in seconds")
    void shouldParseSeconds() {
        assertThat(HttpProviderClient.parseRetryAfter("30")).isEqualTo(Duration.ofSeconds(30));
        assertThat(HttpProviderClient.parseRetryAfter(" 0 ")).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("should parse Retry-After as an HTTP date")
    void shouldParseHttpDate() {
        String date = ZonedDateTime.now(ZoneOffset.UTC).plusMinutes(2).format(DateTimeFormatter.RFC_1123_DATE_TIME);

        Duration parsed = HttpProviderClient.parseRetryAfter(date);

        assertThat(parsed).isBetween(Duration.ofSeconds(100), Duration.ofSeconds(120));
    }

    @Test
    @DisplayName("should clamp a past HTTP date to zero")
    void shouldClampPastDate() {
        assertThat(HttpProviderClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("should cap Retry-After at 24 hours")
    void shouldCapRetryAfter() {
        assertThat(HttpProviderClient.parseRetryAfter("999999999")).isEqualTo(Duration.ofHours(24));
        assertThat(HttpProviderClient.parseRetryAfter("99999999999999999999999")).isEqualTo(Duration.ofHours(24));
        assertThat(HttpProviderClient.parseRetryAfter("-5")).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("should ignore an unparseable Retry-After")
    void shouldIgnoreGarbage() {
        assertThat(HttpProviderClient.parseRetryAfter("soon")).isNull();
    }
}
