package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Protocol credential. Only the BCrypt hash of the secret is stored;
 * keyPrefix holds the first characters of the raw key for candidate lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKey {

    public static final int PREFIX_LENGTH = 12;

    private String id;
    private String userId;
    private String name;
    private String keyHash;
    private String keyPrefix;
    @Builder.Default
    private Set<ApiKeyScope> scopes = EnumSet.noneOf(ApiKeyScope.class);
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant revokedAt;

    public boolean hasScope(ApiKeyScope scope) {
        return scopes != null && scopes.contains(scope);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }
}
