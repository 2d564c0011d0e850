package com.relaymail.service;

import java.time.Duration;

/**
 * Outcome of a rate-limit check for one (client address, protocol) key
 *
 * @param blocked        true if the next attempt must be refused
 * @param failedAttempts failures currently counted for the key
 * @param retryAfter     time until the key may try again, zero when not blocked
 */
public record RateLimitResult(boolean blocked, int failedAttempts, Duration retryAfter) {

    public static RateLimitResult allowed(int failedAttempts) {
        return new RateLimitResult(false, failedAttempts, Duration.ZERO);
    }

    public static RateLimitResult blocked(int failedAttempts, Duration retryAfter) {
        return new RateLimitResult(true, failedAttempts, retryAfter);
    }
}
