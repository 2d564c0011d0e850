package com.relaymail.service;

import at.favre.lib.crypto.bcrypt.BCrypt;
import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.ApiKey;
import com.relaymail.domain.ApiKeyScope;
import com.relaymail.domain.User;
import com.relaymail.mapper.ApiKeyMapper;
import com.relaymail.mapper.UserMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * API-key authentication tests
 */
@ExtendWith(MockitoExtension.class)
class ProtocolAuthenticatorTest {

    private static final String IP = "198.51.100.7";
    private static final String EMAIL = "user@example.com";
    private static final String SECRET = "rmk_a1b2c3d4_9f8e7d6c5b4a";
    private static final String PREFIX = SECRET.substring(0, ApiKey.PREFIX_LENGTH);
    private static final Instant NOW = Instant.parse("2024-03-05T10:15:30Z");

    private static String secretHash;

    @Mock
    private UserMapper userMapper;

    @Mock
    private ApiKeyMapper apiKeyMapper;

    @Mock
    private AuthenticationRateLimiter rateLimiter;

    @Mock
    private BackgroundTaskQueue backgroundTaskQueue;

    private SimpleMeterRegistry meterRegistry;
    private ProtocolAuthenticator authenticator;
    private User user;

    @BeforeAll
    static void hashSecret() {
        secretHash = BCrypt.withDefaults().hashToString(4, SECRET.toCharArray());
    }

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        authenticator = new ProtocolAuthenticator(userMapper, apiKeyMapper, rateLimiter, backgroundTaskQueue,
                meterRegistry, new RelayMailProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        user = User.builder().id("user-1").email(EMAIL).build();
    }

    private ApiKey key(String id, String userId, String prefix, ApiKeyScope... scopes) {
        return ApiKey.builder()
                .id(id)
                .userId(userId)
                .name("key " + id)
                .keyHash(secretHash)
                .keyPrefix(prefix)
                .scopes(scopes.length == 0 ? EnumSet.noneOf(ApiKeyScope.class) : EnumSet.of(scopes[0], scopes))
                .build();
    }

    private void allowAttempts() {
        when(rateLimiter.checkRateLimit(eq(IP), anyString())).thenReturn(RateLimitResult.allowed(0));
        when(rateLimiter.generateCacheKey(EMAIL, SECRET)).thenReturn("cache-key");
    }

    private double failures(String reason) {
        return meterRegistry.counter("relaymail.auth.failures", "protocol", "imap", "reason", reason).count();
    }

    @Test
    @DisplayName("Key with the protocol scope authenticates")
    void testAuthenticate_Success() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-1", "user-1", PREFIX, ApiKeyScope.IMAP)));

        AuthenticationResult result = authenticator.authenticate(" User@Example.com ", SECRET, IP, MailProtocol.IMAP);

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.userId()).isEqualTo("user-1");
        assertThat(result.apiKeyId()).isEqualTo("key-1");
        verify(rateLimiter).recordSuccess(IP, "imap");
        verify(backgroundTaskQueue).queueLastUsedAtUpdate("key-1", NOW);
    }

    @Test
    @DisplayName("Second attempt with the same credentials is served from the cache")
    void testAuthenticate_CacheHit() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-1", "user-1", PREFIX, ApiKeyScope.IMAP)));

        authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);
        AuthenticationResult second = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(second.isAuthenticated()).isTrue();
        verify(userMapper, times(1)).findByEmail(EMAIL);
        verify(backgroundTaskQueue, times(2)).queueLastUsedAtUpdate("key-1", NOW);
    }

    @Test
    @DisplayName("Cached success for one protocol does not authenticate another")
    void testAuthenticate_CacheIsPerProtocol() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-1", "user-1", PREFIX, ApiKeyScope.IMAP)));

        assertThat(authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP).isAuthenticated()).isTrue();
        AuthenticationResult pop3 = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.POP3);

        assertThat(pop3.status()).isEqualTo(AuthenticationResult.Status.SCOPE_DENIED);
        verify(rateLimiter).recordFailure(IP, "pop3");
    }

    @Test
    @DisplayName("Matching key without the scope is denied")
    void testAuthenticate_MissingScope() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-1", "user-1", PREFIX, ApiKeyScope.SMTP)));

        AuthenticationResult result = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.SCOPE_DENIED);
        assertThat(result.user()).isNull();
        verify(rateLimiter).recordFailure(IP, "imap");
        assertThat(failures("missing_scope")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Rate-limited client is refused before any lookup")
    void testAuthenticate_RateLimited() {
        when(rateLimiter.checkRateLimit(IP, "imap")).thenReturn(RateLimitResult.blocked(5, Duration.ofMinutes(3)));

        AuthenticationResult result = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.RATE_LIMITED);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofMinutes(3));
        verifyNoInteractions(userMapper, apiKeyMapper);
        verify(rateLimiter, never()).recordFailure(anyString(), anyString());
        assertThat(failures("rate_limited")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Wrong secret fails and counts a failure")
    void testAuthenticate_WrongSecret() {
        String wrong = PREFIX + "wrong";
        when(rateLimiter.checkRateLimit(IP, "imap")).thenReturn(RateLimitResult.allowed(0));
        when(rateLimiter.generateCacheKey(EMAIL, wrong)).thenReturn("other-key");
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-1", "user-1", PREFIX, ApiKeyScope.IMAP)));

        AuthenticationResult result = authenticator.authenticate(EMAIL, wrong, IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.NOT_FOUND);
        verify(rateLimiter).recordFailure(IP, "imap");
        assertThat(failures("invalid_key")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Prefix match owned by another user is ignored")
    void testAuthenticate_PrefixOfOtherUser() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(key("key-9", "user-9", PREFIX, ApiKeyScope.IMAP)));

        AuthenticationResult result = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.NOT_FOUND);
    }

    @Test
    @DisplayName("Key stored without a prefix is still a candidate")
    void testAuthenticate_KeyWithoutPrefix() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of());
        when(apiKeyMapper.findActiveByUserId("user-1")).thenReturn(List.of(
                key("key-old", "user-1", null, ApiKeyScope.IMAP, ApiKeyScope.POP3)));

        AuthenticationResult result = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.apiKeyId()).isEqualTo("key-old");
    }

    @Test
    @DisplayName("Revoked key is skipped")
    void testAuthenticate_RevokedKey() {
        allowAttempts();
        when(userMapper.findByEmail(EMAIL)).thenReturn(user);
        ApiKey revoked = key("key-1", "user-1", PREFIX, ApiKeyScope.IMAP);
        revoked.setRevokedAt(Instant.parse("2024-01-01T00:00:00Z"));
        when(apiKeyMapper.findActiveByPrefix(PREFIX)).thenReturn(List.of(revoked));

        assertThat(authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP).isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("Unknown user fails")
    void testAuthenticate_UserNotFound() {
        allowAttempts();

        AuthenticationResult result = authenticator.authenticate(EMAIL, SECRET, IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.NOT_FOUND);
        verifyNoInteractions(apiKeyMapper);
        assertThat(failures("user_not_found")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Empty secret fails without a lookup")
    void testAuthenticate_EmptyCredentials() {
        when(rateLimiter.checkRateLimit(IP, "imap")).thenReturn(RateLimitResult.allowed(0));

        AuthenticationResult result = authenticator.authenticate(EMAIL, "", IP, MailProtocol.IMAP);

        assertThat(result.status()).isEqualTo(AuthenticationResult.Status.NOT_FOUND);
        verifyNoInteractions(userMapper);
        verify(rateLimiter).recordFailure(IP, "imap");
    }
}
