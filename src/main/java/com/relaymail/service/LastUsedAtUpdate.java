package com.relaymail.service;

import java.time.Instant;

/**
 * Deferred "credential used" timestamp write
 */
public record LastUsedAtUpdate(String keyId, Instant timestamp) {
}
