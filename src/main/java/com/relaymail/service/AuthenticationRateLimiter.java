package com.relaymail.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relaymail.config.RelayMailProperties;
import com.relaymail.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Failed-authentication tracking per (client address, protocol).
 *
 * Below the lockout threshold every failure imposes an exponential backoff
 * (base * 2^(failures-1), capped) on the next attempt. Reaching the threshold locks
 * the key out until the lockout window measured from the first failure has passed.
 * A success clears the key. Idle entries expire after the lockout window.
 */
@Slf4j
@Service
public class AuthenticationRateLimiter {

    private final RelayMailProperties.RateLimit options;
    private final Clock clock;
    private final Cache<String, FailureEntry> entries;
    private final byte[] cacheKeySecret;

    @Autowired
    public AuthenticationRateLimiter(RelayMailProperties properties) {
        this(properties, Clock.systemUTC());
    }

    AuthenticationRateLimiter(RelayMailProperties properties, Clock clock) {
        this.options = properties.getRateLimit();
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(options.getLockoutWindow())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.cacheKeySecret = deriveSecret(properties.getAuth().getCacheKeySalt());
    }

    public RateLimitResult checkRateLimit(String clientIp, String protocol) {
        String key = rateLimitKey(clientIp, protocol);
        FailureEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return RateLimitResult.allowed(0);
        }

        Instant now = clock.instant();
        if (entry.failedAttempts() >= options.getMaxFailedAttempts()) {
            Instant lockoutEnd = entry.firstFailureAt().plus(options.getLockoutWindow());
            if (now.isBefore(lockoutEnd)) {
                Duration retryAfter = Duration.between(now, lockoutEnd);
                log.warn("{} authentication locked out for {} ({} failures, retry after {}s)",
                        protocol, clientIp, entry.failedAttempts(), retryAfter.toSeconds());
                return RateLimitResult.blocked(entry.failedAttempts(), retryAfter);
            }
            // lockout elapsed
            entries.asMap().remove(key, entry);
            return RateLimitResult.allowed(0);
        }

        Instant nextAllowed = entry.lastFailureAt().plus(backoffFor(entry.failedAttempts()));
        if (now.isBefore(nextAllowed)) {
            return RateLimitResult.blocked(entry.failedAttempts(), Duration.between(now, nextAllowed));
        }
        return RateLimitResult.allowed(entry.failedAttempts());
    }

    public void recordFailure(String clientIp, String protocol) {
        Instant now = clock.instant();
        FailureEntry updated = entries.asMap().compute(rateLimitKey(clientIp, protocol), (key, existing) -> {
            if (existing == null || !now.isBefore(existing.firstFailureAt().plus(options.getLockoutWindow()))) {
                return new FailureEntry(1, now, now);
            }
            return new FailureEntry(existing.failedAttempts() + 1, existing.firstFailureAt(), now);
        });

        if (updated.failedAttempts() == options.getMaxFailedAttempts()) {
            log.warn("{} authentication lockout engaged for {} after {} failures",
                    protocol, clientIp, updated.failedAttempts());
        } else {
            log.debug("{} authentication failure {} recorded for {}", protocol, updated.failedAttempts(), clientIp);
        }
    }

    public void recordSuccess(String clientIp, String protocol) {
        entries.invalidate(rateLimitKey(clientIp, protocol));
    }

    public int getFailedAttempts(String clientIp, String protocol) {
        FailureEntry entry = entries.getIfPresent(rateLimitKey(clientIp, protocol));
        return entry == null ? 0 : entry.failedAttempts();
    }

    /**
     * Cache key for a credential pair. Raw credentials never leave this method.
     */
    public String generateCacheKey(String normalizedEmail, String password) {
        return CryptoUtil.hmacSha256Base64(cacheKeySecret, normalizedEmail + ":" + password);
    }

    Duration backoffFor(int failedAttempts) {
        if (failedAttempts <= 0) {
            return Duration.ZERO;
        }
        long baseMillis = options.getBaseBackoff().toMillis();
        long maxMillis = options.getMaxBackoff().toMillis();
        int exponent = Math.min(failedAttempts - 1, 30);
        if (baseMillis > (maxMillis >> exponent)) {
            return Duration.ofMillis(maxMillis);
        }
        return Duration.ofMillis(Math.min(baseMillis << exponent, maxMillis));
    }

    static String rateLimitKey(String clientIp, String protocol) {
        return "ratelimit:" + protocol + ":" + clientIp;
    }

    private static byte[] deriveSecret(String salt) {
        if (salt != null && !salt.isBlank()) {
            return CryptoUtil.sha256(salt);
        }
        byte[] secret = new byte[32];
        new SecureRandom().nextBytes(secret);
        return secret;
    }

    private record FailureEntry(int failedAttempts, Instant firstFailureAt, Instant lastFailureAt) {
    }
}
