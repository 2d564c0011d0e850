package com.relaymail.service;

import at.favre.lib.crypto.bcrypt.BCrypt;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.ApiKey;
import com.relaymail.domain.User;
import com.relaymail.mapper.ApiKeyMapper;
import com.relaymail.mapper.UserMapper;
import com.relaymail.util.CryptoUtil;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * API-key authentication shared by the IMAP, POP3 and SMTP listeners.
 *
 * - Rate limit check per (client address, protocol) before any verification
 * - 30-second cache of successful results, keyed by an HMAC of the credential pair
 * - BCrypt verification against the user's active keys
 * - A matching key without the protocol's scope is a hard failure
 * - last-used timestamps are written through {@link BackgroundTaskQueue}
 */
@Slf4j
@Service
public class ProtocolAuthenticator {

    private final UserMapper userMapper;
    private final ApiKeyMapper apiKeyMapper;
    private final AuthenticationRateLimiter rateLimiter;
    private final BackgroundTaskQueue backgroundTaskQueue;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<MailProtocol, Cache<String, CachedAuthentication>> authCaches = new EnumMap<>(MailProtocol.class);

    @Autowired
    public ProtocolAuthenticator(UserMapper userMapper,
                                 ApiKeyMapper apiKeyMapper,
                                 AuthenticationRateLimiter rateLimiter,
                                 BackgroundTaskQueue backgroundTaskQueue,
                                 MeterRegistry meterRegistry,
                                 RelayMailProperties properties) {
        this(userMapper, apiKeyMapper, rateLimiter, backgroundTaskQueue, meterRegistry, properties, Clock.systemUTC());
    }

    ProtocolAuthenticator(UserMapper userMapper,
                          ApiKeyMapper apiKeyMapper,
                          AuthenticationRateLimiter rateLimiter,
                          BackgroundTaskQueue backgroundTaskQueue,
                          MeterRegistry meterRegistry,
                          RelayMailProperties properties,
                          Clock clock) {
        this.userMapper = userMapper;
        this.apiKeyMapper = apiKeyMapper;
        this.rateLimiter = rateLimiter;
        this.backgroundTaskQueue = backgroundTaskQueue;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        RelayMailProperties.Auth auth = properties.getAuth();
        for (MailProtocol protocol : MailProtocol.values()) {
            authCaches.put(protocol, Caffeine.newBuilder()
                    .maximumSize(auth.getCacheMaxSize())
                    .expireAfterWrite(auth.getCacheTtl())
                    .build());
        }
    }

    public AuthenticationResult authenticate(String username, String password, String clientIp, MailProtocol protocol) {
        String name = protocol.name();
        meterRegistry.counter("relaymail.auth.attempts", "protocol", protocol.getKey()).increment();

        RateLimitResult rateLimit = rateLimiter.checkRateLimit(clientIp, protocol.getKey());
        if (rateLimit.blocked()) {
            log.warn("{} authentication rate limited for {} from {}", name, username, clientIp);
            countFailure(protocol, "rate_limited");
            return AuthenticationResult.rateLimited(rateLimit.retryAfter());
        }

        String email = CryptoUtil.normalizeAddress(username);
        if (email == null || email.isEmpty() || password == null || password.isEmpty()) {
            log.warn("{} authentication failed: empty credentials from {}", name, clientIp);
            return fail(protocol, clientIp, "empty_credentials", AuthenticationResult.notFound());
        }

        Cache<String, CachedAuthentication> cache = authCaches.get(protocol);
        String cacheKey = rateLimiter.generateCacheKey(email, password);
        CachedAuthentication cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("{} authentication cache hit for {}", name, email);
            rateLimiter.recordSuccess(clientIp, protocol.getKey());
            backgroundTaskQueue.queueLastUsedAtUpdate(cached.apiKeyId(), clock.instant());
            return AuthenticationResult.success(cached.user(), cached.apiKeyId());
        }

        User user = userMapper.findByEmail(email);
        if (user == null) {
            log.warn("{} authentication failed: user not found: {}", name, email);
            return fail(protocol, clientIp, "user_not_found", AuthenticationResult.notFound());
        }

        for (ApiKey apiKey : findCandidates(user, password)) {
            if (apiKey.isRevoked() || !verify(password, apiKey)) {
                continue;
            }
            if (!apiKey.hasScope(protocol.getRequiredScope())) {
                log.warn("{} authentication failed for {}: API key '{}' lacks '{}' scope",
                        name, email, apiKey.getName(), protocol.getRequiredScope().getValue());
                return fail(protocol, clientIp, "missing_scope", AuthenticationResult.scopeDenied());
            }

            log.info("{} user authenticated: {} using key: {}", name, email, apiKey.getName());
            rateLimiter.recordSuccess(clientIp, protocol.getKey());
            cache.put(cacheKey, new CachedAuthentication(user, apiKey.getId()));
            backgroundTaskQueue.queueLastUsedAtUpdate(apiKey.getId(), clock.instant());
            return AuthenticationResult.success(user, apiKey.getId());
        }

        log.warn("{} authentication failed: invalid API key for user: {}", name, email);
        return fail(protocol, clientIp, "invalid_key", AuthenticationResult.notFound());
    }

    /**
     * Keys whose stored prefix matches the secret, plus the user's keys created before
     * prefixes were stored.
     */
    private List<ApiKey> findCandidates(User user, String secret) {
        List<ApiKey> candidates = new ArrayList<>();
        if (secret.length() >= ApiKey.PREFIX_LENGTH) {
            apiKeyMapper.findActiveByPrefix(secret.substring(0, ApiKey.PREFIX_LENGTH)).stream()
                    .filter(key -> user.getId().equals(key.getUserId()))
                    .forEach(candidates::add);
        }
        apiKeyMapper.findActiveByUserId(user.getId()).stream()
                .filter(key -> key.getKeyPrefix() == null || key.getKeyPrefix().isEmpty())
                .forEach(candidates::add);
        return candidates;
    }

    private boolean verify(String secret, ApiKey apiKey) {
        if (apiKey.getKeyHash() == null) {
            return false;
        }
        try {
            return BCrypt.verifyer()
                    .verify(secret.getBytes(StandardCharsets.UTF_8), apiKey.getKeyHash().getBytes(StandardCharsets.UTF_8))
                    .verified;
        } catch (IllegalArgumentException e) {
            log.warn("API key {} has an unreadable hash: {}", apiKey.getId(), e.getMessage());
            return false;
        }
    }

    private AuthenticationResult fail(MailProtocol protocol, String clientIp, String reason, AuthenticationResult result) {
        rateLimiter.recordFailure(clientIp, protocol.getKey());
        countFailure(protocol, reason);
        return result;
    }

    private void countFailure(MailProtocol protocol, String reason) {
        meterRegistry.counter("relaymail.auth.failures", "protocol", protocol.getKey(), "reason", reason).increment();
    }

    private record CachedAuthentication(User user, String apiKeyId) {
    }
}
