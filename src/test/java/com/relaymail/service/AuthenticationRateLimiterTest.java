package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Failed-authentication backoff and lockout tests
 */
class AuthenticationRateLimiterTest {

    private static final String IP = "192.0.2.10";

    private MutableClock clock;
    private AuthenticationRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        RelayMailProperties properties = new RelayMailProperties();
        properties.getAuth().setCacheKeySalt("test-salt");
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        rateLimiter = new AuthenticationRateLimiter(properties, clock);
    }

    @Test
    @DisplayName("No failures: allowed")
    void testCheckRateLimit_NoFailures() {
        RateLimitResult result = rateLimiter.checkRateLimit(IP, "imap");

        assertThat(result.blocked()).isFalse();
        assertThat(result.failedAttempts()).isZero();
    }

    @Test
    @DisplayName("A failure delays the next attempt by the backoff")
    void testCheckRateLimit_Backoff() {
        rateLimiter.recordFailure(IP, "imap");
        rateLimiter.recordFailure(IP, "imap");

        RateLimitResult blocked = rateLimiter.checkRateLimit(IP, "imap");
        assertThat(blocked.blocked()).isTrue();
        assertThat(blocked.retryAfter()).isEqualTo(Duration.ofSeconds(2));

        clock.advance(Duration.ofSeconds(2));
        RateLimitResult allowed = rateLimiter.checkRateLimit(IP, "imap");
        assertThat(allowed.blocked()).isFalse();
        assertThat(allowed.failedAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Backoff doubles per failure and is capped")
    void testBackoffFor() {
        assertThat(rateLimiter.backoffFor(0)).isEqualTo(Duration.ZERO);
        assertThat(rateLimiter.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(rateLimiter.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(rateLimiter.backoffFor(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(rateLimiter.backoffFor(1000)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Lockout after max failures lasts until the window from the first failure ends")
    void testCheckRateLimit_Lockout() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordFailure(IP, "pop3");
            clock.advance(Duration.ofMinutes(1));
        }

        RateLimitResult locked = rateLimiter.checkRateLimit(IP, "pop3");
        assertThat(locked.blocked()).isTrue();
        assertThat(locked.failedAttempts()).isEqualTo(5);
        assertThat(locked.retryAfter()).isEqualTo(Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(10));
        RateLimitResult released = rateLimiter.checkRateLimit(IP, "pop3");
        assertThat(released.blocked()).isFalse();
        assertThat(released.failedAttempts()).isZero();
    }

    @Test
    @DisplayName("Success clears the failure count")
    void testRecordSuccess() {
        rateLimiter.recordFailure(IP, "imap");

        rateLimiter.recordSuccess(IP, "imap");

        assertThat(rateLimiter.getFailedAttempts(IP, "imap")).isZero();
        assertThat(rateLimiter.checkRateLimit(IP, "imap").blocked()).isFalse();
    }

    @Test
    @DisplayName("Failures are counted per protocol")
    void testRecordFailure_PerProtocol() {
        rateLimiter.recordFailure(IP, "imap");

        assertThat(rateLimiter.getFailedAttempts(IP, "imap")).isEqualTo(1);
        assertThat(rateLimiter.getFailedAttempts(IP, "pop3")).isZero();
        assertThat(rateLimiter.checkRateLimit(IP, "pop3").blocked()).isFalse();
    }

    @Test
    @DisplayName("Cache key is stable and hides the secret")
    void testGenerateCacheKey() {
        String key = rateLimiter.generateCacheKey("user@example.com", "secret-value");

        assertThat(key).isEqualTo(rateLimiter.generateCacheKey("user@example.com", "secret-value"));
        assertThat(key).isNotEqualTo(rateLimiter.generateCacheKey("user@example.com", "other-value"));
        assertThat(key).doesNotContain("secret-value");
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
