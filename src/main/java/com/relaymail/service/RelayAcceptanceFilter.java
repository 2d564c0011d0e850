package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.mapper.UserMapper;
import com.relaymail.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Open relay prevention for the inbound SMTP listener.
 *
 * Authenticated sessions may send anywhere. Anonymous sessions are only served on the
 * MX port, and there only for recipients at a hosted domain. Anonymous use of any other
 * port (submission included) is rejected.
 */
@Slf4j
@Service
public class RelayAcceptanceFilter {

    private final RelayMailProperties.Mx mx;
    private final UserMapper userMapper;
    private final Set<String> hostedDomains;

    public RelayAcceptanceFilter(RelayMailProperties properties, UserMapper userMapper) {
        this.mx = properties.getMx();
        this.userMapper = userMapper;
        this.hostedDomains = mx.getHostedDomains().stream()
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * MAIL FROM check
     */
    public boolean canAcceptFrom(SmtpTransactionContext context, String from) {
        if (!mx.isEnabled() || context.isAuthenticated()) {
            return true;
        }
        if (context.endpointPort() == mx.getPort()) {
            log.debug("MX: Accepting MAIL FROM {} on port {}", from, context.endpointPort());
            return true;
        }
        log.warn("Rejected unauthenticated MAIL FROM {} on port {} from {}", from, context.endpointPort(), context.clientIp());
        return false;
    }

    /**
     * RCPT TO check
     */
    public boolean canDeliverTo(SmtpTransactionContext context, String to, String from) {
        if (!mx.isEnabled() || context.isAuthenticated()) {
            return true;
        }
        if (context.endpointPort() != mx.getPort()) {
            log.warn("Rejected unauthenticated RCPT TO {} on port {} from {}", to, context.endpointPort(), context.clientIp());
            return false;
        }

        String recipient = CryptoUtil.normalizeAddress(to);
        String domain = CryptoUtil.extractDomain(recipient);
        if (domain == null || !hostedDomains.contains(domain)) {
            log.warn("MX: Rejected relay attempt, recipient {} is not at a hosted domain. From: {}", to, from);
            return false;
        }

        if (mx.isValidateRecipients() && userMapper.findByEmail(recipient) == null) {
            log.warn("MX: Rejected mail to unknown user {} at hosted domain. From: {}", to, from);
            return false;
        }

        log.debug("MX: Accepted RCPT TO {} from {}", to, from);
        return true;
    }
}
