package com.relaymail.service;

/**
 * What the inbound SMTP listener knows about a transaction when it asks for a relay
 * decision or hands over a message.
 *
 * @param authenticatedUserId user id after a successful AUTH, null for anonymous sessions
 * @param endpointPort        local port the client connected to
 * @param clientIp            remote address, "unknown" when not available
 */
public record SmtpTransactionContext(String authenticatedUserId, int endpointPort, String clientIp) {

    public boolean isAuthenticated() {
        return authenticatedUserId != null;
    }
}
