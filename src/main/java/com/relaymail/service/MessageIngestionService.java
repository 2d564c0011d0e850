package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.Email;
import com.relaymail.domain.EmailAttachment;
import com.relaymail.domain.EmailRecipient;
import com.relaymail.domain.RecipientType;
import com.relaymail.domain.User;
import com.relaymail.mapper.EmailMapper;
import com.relaymail.mapper.UserMapper;
import com.relaymail.util.CryptoUtil;
import com.relaymail.util.EmlParser;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Stores a message accepted by the inbound SMTP listener (after DATA)
 * - Enforces message and attachment size limits
 * - Parses the EML with Jakarta Mail and resolves the thread from In-Reply-To
 * - Links recipients to local users
 * - Persists email, recipients and attachments in one transaction
 * - Notifies the recipient users
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageIngestionService {

    private final EmailMapper emailMapper;
    private final UserMapper userMapper;
    private final EmailNotificationService notificationService;
    private final RelayMailProperties properties;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate transactionTemplate;

    /**
     * @param context transaction the message arrived in
     * @param raw     raw EML bytes as received
     */
    public IngestionResult ingest(SmtpTransactionContext context, byte[] raw) {
        RelayMailProperties.Smtp limits = properties.getSmtp();
        if (raw.length > limits.getMaxMessageSizeBytes()) {
            log.warn("Message rejected: size {} bytes exceeds limit {} bytes", raw.length, limits.getMaxMessageSizeBytes());
            return IngestionResult.messageTooLarge();
        }

        try {
            MimeMessage mime = EmlParser.parse(raw);
            Email email = buildEmail(context, mime, raw.length);

            for (Part part : EmlParser.findAttachments(mime)) {
                byte[] content = readContent(part);
                String fileName = part.getFileName() != null ? part.getFileName() : EmlParser.fileNameFor(part.getContentType());
                if (content.length > limits.getMaxAttachmentSizeBytes()) {
                    log.warn("Attachment '{}' rejected: size {} bytes exceeds limit {} bytes",
                            fileName, content.length, limits.getMaxAttachmentSizeBytes());
                    return IngestionResult.attachmentTooLarge(fileName);
                }
                email.getAttachments().add(EmailAttachment.builder()
                        .id(UUID.randomUUID().toString())
                        .emailId(email.getId())
                        .fileName(fileName)
                        .contentType(EmlParser.baseType(part.getContentType()))
                        .sizeBytes(content.length)
                        .content(content)
                        .build());
            }

            transactionTemplate.executeWithoutResult(status -> persist(email));

            log.info("Email saved: {} from {} to {}", email.getMessageId(), email.getFromAddress(),
                    email.getRecipients().stream().map(EmailRecipient::getAddress).collect(Collectors.joining(", ")));

            notifyRecipients(email);
            meterRegistry.counter("relaymail.smtp.messages.received").increment();
            meterRegistry.counter("relaymail.smtp.bytes.received").increment(raw.length);
            return IngestionResult.accepted(email.getId());
        } catch (Exception e) {
            log.error("Failed to save email from {}", context.clientIp(), e);
            return IngestionResult.transactionFailed();
        }
    }

    private Email buildEmail(SmtpTransactionContext context, MimeMessage mime, long size)
            throws MessagingException, IOException {
        String inReplyTo = EmlParser.header(mime, "In-Reply-To");

        InternetAddress from = firstAddress(mime.getFrom());
        Email email = Email.builder()
                .id(UUID.randomUUID().toString())
                .messageId(EmlParser.extractMessageId(mime, properties.getOutbound().getSenderDomain()))
                .fromAddress(from != null ? from.getAddress() : "")
                .fromDisplayName(from != null ? from.getPersonal() : null)
                .subject(EmlParser.extractSubject(mime))
                .textBody(EmlParser.findTextBody(mime, "text/plain"))
                .htmlBody(EmlParser.findTextBody(mime, "text/html"))
                .receivedAt(Instant.now())
                .sizeBytes(size)
                .inReplyTo(inReplyTo)
                .references(EmlParser.header(mime, "References"))
                .threadId(resolveThreadId(inReplyTo))
                .sentByUserId(context.authenticatedUserId())
                .build();

        addRecipients(email, mime.getRecipients(Message.RecipientType.TO), RecipientType.TO);
        addRecipients(email, mime.getRecipients(Message.RecipientType.CC), RecipientType.CC);
        addRecipients(email, mime.getRecipients(Message.RecipientType.BCC), RecipientType.BCC);
        return email;
    }

    /**
     * Thread of the parent message, or the parent itself when it starts the thread
     */
    private String resolveThreadId(String inReplyTo) {
        if (inReplyTo == null) {
            return null;
        }
        Email parent = emailMapper.findByMessageId(inReplyTo);
        if (parent == null) {
            return null;
        }
        return parent.getThreadId() != null ? parent.getThreadId() : parent.getId();
    }

    private void addRecipients(Email email, Address[] addresses, RecipientType type) {
        if (addresses == null) {
            return;
        }
        for (Address address : addresses) {
            if (!(address instanceof InternetAddress internetAddress)) {
                continue;
            }
            User user = userMapper.findByEmail(CryptoUtil.normalizeAddress(internetAddress.getAddress()));
            email.getRecipients().add(EmailRecipient.builder()
                    .id(UUID.randomUUID().toString())
                    .emailId(email.getId())
                    .address(internetAddress.getAddress())
                    .displayName(internetAddress.getPersonal())
                    .type(type)
                    .userId(user != null ? user.getId() : null)
                    .read(false)
                    .build());
        }
    }

    private void persist(Email email) {
        emailMapper.insert(email);
        email.getRecipients().forEach(emailMapper::insertRecipient);
        email.getAttachments().forEach(emailMapper::insertAttachment);
    }

    private void notifyRecipients(Email email) {
        Set<String> userIds = email.getRecipients().stream()
                .map(EmailRecipient::getUserId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (userIds.isEmpty()) {
            return;
        }
        try {
            notificationService.notifyNewEmail(userIds, email);
        } catch (RuntimeException e) {
            log.warn("New mail notification failed for {}: {}", email.getMessageId(), e.getMessage());
        }
    }

    private static InternetAddress firstAddress(Address[] addresses) {
        if (addresses == null) {
            return null;
        }
        for (Address address : addresses) {
            if (address instanceof InternetAddress internetAddress) {
                return internetAddress;
            }
        }
        return null;
    }

    private static byte[] readContent(Part part) throws MessagingException, IOException {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        }
    }
}
