package com.relaymail.service;

import com.relaymail.domain.ApiKeyScope;

/**
 * Protocol listeners that authenticate with API keys
 */
public enum MailProtocol {
    SMTP("smtp", ApiKeyScope.SMTP),
    POP3("pop3", ApiKeyScope.POP3),
    IMAP("imap", ApiKeyScope.IMAP);

    private final String key;
    private final ApiKeyScope requiredScope;

    MailProtocol(String key, ApiKeyScope requiredScope) {
        this.key = key;
        this.requiredScope = requiredScope;
    }

    /** Lower-case name used in rate-limit keys and metric tags */
    public String getKey() {
        return key;
    }

    public ApiKeyScope getRequiredScope() {
        return requiredScope;
    }
}
