package com.relaymail.protocol;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-user count of open authenticated connections for one protocol listener
 */
@Slf4j
public class ConnectionRegistry {

    private final String protocol;
    private final ConcurrentMap<String, Integer> counts = new ConcurrentHashMap<>();

    public ConnectionRegistry(String protocol) {
        this.protocol = protocol;
    }

    /**
     * Reserve a connection slot for the user.
     *
     * @return false if the user already holds maxConnections slots
     */
    public boolean tryAddConnection(String userId, int maxConnections) {
        if (maxConnections <= 0) {
            return false;
        }
        while (true) {
            Integer current = counts.putIfAbsent(userId, 1);
            if (current == null) {
                return true;
            }
            if (current >= maxConnections) {
                log.info("{} connection limit ({}) reached for user {}", protocol, maxConnections, userId);
                return false;
            }
            if (counts.replace(userId, current, current + 1)) {
                return true;
            }
        }
    }

    public void removeConnection(String userId) {
        if (userId == null) {
            return;
        }
        counts.computeIfPresent(userId, (key, count) -> count <= 1 ? null : count - 1);
    }

    public int getConnectionCount(String userId) {
        return counts.getOrDefault(userId, 0);
    }
}
