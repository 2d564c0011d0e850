package com.relaymail.protocol;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * State shared by every per-connection protocol session.
 * A session is owned by the handler of a single channel and is never shared.
 */
@Getter
@Setter
public abstract class ProtocolSession {

    private final String connectionId = UUID.randomUUID().toString();
    private final Instant connectedAt = Instant.now();
    private Instant lastActivityAt = connectedAt;
    private String clientIp = "unknown";

    // Authentication
    private String username;
    private String userId;

    public boolean isAuthenticated() {
        return userId != null;
    }

    public void touch() {
        this.lastActivityAt = Instant.now();
    }
}
