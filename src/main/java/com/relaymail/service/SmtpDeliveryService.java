package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.OutboundAttachment;
import com.relaymail.domain.OutboundEmail;
import com.relaymail.domain.OutboundRecipient;
import com.relaymail.domain.RecipientType;
import com.relaymail.util.CryptoUtil;
import com.relaymail.util.EmlParser;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.eclipse.angus.mail.smtp.SMTPSenderFailedException;
import org.eclipse.angus.mail.smtp.SMTPTransport;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * SMTP client side of outbound delivery
 * - Relay mode: one authenticated STARTTLS session to the configured smarthost
 * - Direct mode: recipients grouped by domain, MX hosts tried in preference order on port 25
 *
 * Returns one result per recipient per host tried; the last result for a recipient is final.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmtpDeliveryService {

    static final int MX_PORT = 25;

    private final MxResolverService mxResolver;
    private final RelayMailProperties properties;

    public List<DeliveryResult> deliver(OutboundEmail email) {
        List<DeliveryResult> results = new ArrayList<>();

        Map<OutboundRecipient, InternetAddress> targets = new LinkedHashMap<>();
        for (OutboundRecipient recipient : email.getRecipients()) {
            if (!recipient.isAwaitingDelivery()) {
                continue;
            }
            InternetAddress address = parseRecipient(recipient.getAddress());
            if (address == null) {
                log.warn("Email {}: invalid recipient address '{}'", email.getId(), recipient.getAddress());
                results.add(DeliveryResult.failed(recipient.getId(), recipient.getAddress(), null, null, null,
                        "Invalid recipient address", Duration.ZERO));
            } else {
                targets.put(recipient, address);
            }
        }
        if (targets.isEmpty()) {
            return results;
        }

        MimeMessage message = buildMessage(email);
        RelayMailProperties.Outbound outbound = properties.getOutbound();
        if (outbound.hasRelayHost()) {
            results.addAll(deliverViaRelay(email, message, targets));
        } else {
            Map<String, Map<OutboundRecipient, InternetAddress>> byDomain = new LinkedHashMap<>();
            targets.forEach((recipient, address) -> byDomain
                    .computeIfAbsent(CryptoUtil.extractDomain(address.getAddress()), d -> new LinkedHashMap<>())
                    .put(recipient, address));
            byDomain.forEach((domain, domainTargets) ->
                    results.addAll(deliverToMx(email, message, domain, domainTargets)));
        }
        return results;
    }

    private List<DeliveryResult> deliverViaRelay(OutboundEmail email, MimeMessage message,
                                                 Map<OutboundRecipient, InternetAddress> targets) {
        RelayMailProperties.Outbound outbound = properties.getOutbound();
        String relayHost = outbound.getRelayHost();
        Session session = createSession(relayHost, outbound.getRelayPort(), outbound.isRelayUseTls(),
                outbound.getRelayUsername() != null && !outbound.getRelayUsername().isBlank());

        List<DeliveryResult> results = new ArrayList<>();
        long start = System.nanoTime();
        Transport transport = null;
        try {
            transport = connect(session, relayHost, outbound.getRelayPort(),
                    outbound.getRelayUsername(), outbound.getRelayPassword());
            transport.sendMessage(message, targets.values().toArray(new Address[0]));

            Duration elapsed = since(start);
            Integer code = lastReturnCode(transport);
            String response = lastServerResponse(transport);
            targets.keySet().forEach(r -> results.add(
                    DeliveryResult.delivered(r.getId(), r.getAddress(), relayHost, code, response, elapsed)));
            log.info("Email {} delivered via relay {} to {} recipients", email.getId(), relayHost, targets.size());
        } catch (MessagingException e) {
            Duration elapsed = since(start);
            log.error("Failed to deliver email {} via relay {}: {}", email.getId(), relayHost, e.getMessage());
            Integer code = smtpStatusCode(e);
            targets.keySet().forEach(r -> results.add(DeliveryResult.failed(
                    r.getId(), r.getAddress(), relayHost, code, smtpResponse(e), e.getMessage(), elapsed)));
        } finally {
            close(transport, relayHost);
        }
        return results;
    }

    private List<DeliveryResult> deliverToMx(OutboundEmail email, MimeMessage message, String domain,
                                             Map<OutboundRecipient, InternetAddress> targets) {
        List<DeliveryResult> results = new ArrayList<>();
        List<String> mxHosts = mxResolver.resolveMxHosts(domain);
        Address[] addresses = targets.values().toArray(new Address[0]);

        for (String mxHost : mxHosts) {
            long start = System.nanoTime();
            Transport transport = null;
            try {
                transport = connect(createSession(mxHost, MX_PORT, false, false), mxHost, MX_PORT, null, null);
                transport.sendMessage(message, addresses);

                Duration elapsed = since(start);
                Integer code = lastReturnCode(transport);
                String response = lastServerResponse(transport);
                targets.keySet().forEach(r -> results.add(
                        DeliveryResult.delivered(r.getId(), r.getAddress(), mxHost, code, response, elapsed)));
                log.info("Email {} delivered to {} via MX {}", email.getId(), domain, mxHost);
                return results;
            } catch (MessagingException e) {
                Duration elapsed = since(start);
                log.warn("Failed to deliver to MX host {} for domain {}, trying next MX: {}", mxHost, domain, e.getMessage());
                Integer code = smtpStatusCode(e);
                targets.keySet().forEach(r -> results.add(DeliveryResult.failed(
                        r.getId(), r.getAddress(), mxHost, code, smtpResponse(e), e.getMessage(), elapsed)));
            } finally {
                close(transport, mxHost);
            }
        }

        String error = "All MX hosts for " + domain + " failed";
        String firstHost = mxHosts.isEmpty() ? domain : mxHosts.get(0);
        targets.keySet().forEach(r -> results.add(
                DeliveryResult.failed(r.getId(), r.getAddress(), firstHost, null, null, error, Duration.ZERO)));
        return results;
    }

    /**
     * To and Cc are written as headers; Bcc recipients only appear in the envelope
     */
    MimeMessage buildMessage(OutboundEmail email) {
        RelayMailProperties.Outbound outbound = properties.getOutbound();
        if (email.getMessageId() == null || email.getMessageId().isBlank()) {
            email.setMessageId("<" + UUID.randomUUID() + "@" + outbound.getSenderDomain() + ">");
        }

        try {
            MimeMessage message = EmlParser.newMessage(EmlParser.getSession(), email.getMessageId());
            message.setFrom(new InternetAddress(email.getFromAddress(), email.getFromDisplayName(), "UTF-8"));
            for (OutboundRecipient recipient : email.getRecipients()) {
                if (recipient.getType() == RecipientType.BCC) {
                    continue;
                }
                InternetAddress address = new InternetAddress(recipient.getAddress(), recipient.getDisplayName(), "UTF-8");
                message.addRecipient(recipient.getType() == RecipientType.CC
                        ? Message.RecipientType.CC : Message.RecipientType.TO, address);
            }

            message.setSubject(email.getSubject() != null ? email.getSubject() : "", "UTF-8");
            Instant date = email.getQueuedAt() != null ? email.getQueuedAt() : Instant.now();
            message.setSentDate(Date.from(date));
            if (email.getInReplyTo() != null && !email.getInReplyTo().isBlank()) {
                message.setHeader("In-Reply-To", email.getInReplyTo());
            }
            if (email.getReferences() != null && !email.getReferences().isBlank()) {
                message.setHeader("References", email.getReferences());
            }

            List<MimeBodyPart> attachments = new ArrayList<>();
            for (OutboundAttachment attachment : email.getAttachments()) {
                attachments.add(EmlParser.attachmentPart(
                        attachment.getFileName(), attachment.getContentType(), attachment.getContent()));
            }
            EmlParser.setBody(message, email.getTextBody(), email.getHtmlBody(), attachments);
            message.saveChanges();
            return message;
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw new MessageAccessException("Failed to build outbound email " + email.getId(), e);
        }
    }

    Session createSession(String host, int port, boolean requireTls, boolean authenticate) {
        RelayMailProperties.Outbound outbound = properties.getOutbound();
        String timeout = String.valueOf(outbound.getSmtpTimeoutSeconds() * 1000L);

        Properties props = new Properties();
        props.setProperty("mail.smtp.host", host);
        props.setProperty("mail.smtp.port", String.valueOf(port));
        props.setProperty("mail.smtp.localhost", outbound.getSenderDomain());
        props.setProperty("mail.smtp.connectiontimeout", timeout);
        props.setProperty("mail.smtp.timeout", timeout);
        props.setProperty("mail.smtp.writetimeout", timeout);
        props.setProperty("mail.smtp.auth", String.valueOf(authenticate));
        props.setProperty("mail.smtp.starttls.enable", "true");
        props.setProperty("mail.smtp.starttls.required", String.valueOf(requireTls));
        if (!requireTls) {
            // Opportunistic STARTTLS towards MX hosts
            props.setProperty("mail.smtp.ssl.trust", "*");
        }
        return Session.getInstance(props);
    }

    protected Transport connect(Session session, String host, int port, String username, String password)
            throws MessagingException {
        Transport transport = session.getTransport("smtp");
        transport.connect(host, port, username, password);
        return transport;
    }

    private static InternetAddress parseRecipient(String address) {
        if (address == null || CryptoUtil.extractDomain(address) == null) {
            return null;
        }
        try {
            InternetAddress parsed = new InternetAddress(address.trim(), true);
            parsed.validate();
            return parsed;
        } catch (AddressException e) {
            return null;
        }
    }

    private static Integer smtpStatusCode(MessagingException e) {
        for (Exception current = e; current instanceof MessagingException me; current = me.getNextException()) {
            if (me instanceof SMTPSendFailedException sfe) {
                return sfe.getReturnCode();
            }
            if (me instanceof SMTPAddressFailedException afe) {
                return afe.getReturnCode();
            }
            if (me instanceof SMTPSenderFailedException senderFailed) {
                return senderFailed.getReturnCode();
            }
        }
        return null;
    }

    private static String smtpResponse(MessagingException e) {
        return smtpStatusCode(e) != null ? e.getMessage() : null;
    }

    private static Integer lastReturnCode(Transport transport) {
        return transport instanceof SMTPTransport smtp ? smtp.getLastReturnCode() : null;
    }

    private static String lastServerResponse(Transport transport) {
        if (transport instanceof SMTPTransport smtp && smtp.getLastServerResponse() != null) {
            return smtp.getLastServerResponse().trim();
        }
        return null;
    }

    private static void close(Transport transport, String host) {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (MessagingException e) {
            log.debug("Error closing SMTP connection to {}: {}", host, e.getMessage());
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
