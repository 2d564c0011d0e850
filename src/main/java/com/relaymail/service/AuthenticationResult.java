package com.relaymail.service;

import com.relaymail.domain.User;

import java.time.Duration;

/**
 * Outcome of a protocol authentication attempt.
 * Callers must show every non-success status to the client as the same generic failure.
 */
public record AuthenticationResult(Status status, User user, String apiKeyId, Duration retryAfter) {

    public enum Status {
        SUCCESS,
        /** Unknown user or no key matched the secret */
        NOT_FOUND,
        /** A key matched but lacks the protocol's scope */
        SCOPE_DENIED,
        /** Refused before verification by the rate limiter */
        RATE_LIMITED
    }

    public static AuthenticationResult success(User user, String apiKeyId) {
        return new AuthenticationResult(Status.SUCCESS, user, apiKeyId, Duration.ZERO);
    }

    public static AuthenticationResult notFound() {
        return new AuthenticationResult(Status.NOT_FOUND, null, null, Duration.ZERO);
    }

    public static AuthenticationResult scopeDenied() {
        return new AuthenticationResult(Status.SCOPE_DENIED, null, null, Duration.ZERO);
    }

    public static AuthenticationResult rateLimited(Duration retryAfter) {
        return new AuthenticationResult(Status.RATE_LIMITED, null, null, retryAfter);
    }

    public boolean isAuthenticated() {
        return status == Status.SUCCESS;
    }

    public String userId() {
        return user != null ? user.getId() : null;
    }
}
