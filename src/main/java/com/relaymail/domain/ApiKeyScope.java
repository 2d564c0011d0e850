package com.relaymail.domain;

import java.util.Locale;

/**
 * Permission scopes that can be granted to an API key
 */
public enum ApiKeyScope {
    SMTP("smtp"),
    POP3("pop3"),
    IMAP("imap"),
    API_READ("api:read"),
    API_WRITE("api:write"),
    APP("app");

    private final String value;

    ApiKeyScope(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a stored scope string.
     *
     * @throws IllegalArgumentException if the value is not a known scope
     */
    public static ApiKeyScope fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ApiKeyScope scope : values()) {
                if (scope.value.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new IllegalArgumentException("Unknown API key scope: " + value);
    }
}
