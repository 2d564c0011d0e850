package com.relaymail.service;

import com.relaymail.domain.Email;
import com.relaymail.domain.EmailAttachment;
import com.relaymail.domain.EmailRecipient;
import com.relaymail.domain.MailboxEntry;
import com.relaymail.mapper.EmailMapper;
import com.relaymail.util.EmlParser;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Read/write access to a user's stored INBOX for the IMAP and POP3 engines
 * - Listing with per-user flags
 * - RFC 822 rendering of stored records
 * - Flag updates and deletions
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxMessageService {

    /** Flag bits that are persisted per user (everything but \Recent) */
    public static final int PERSISTED_FLAGS = 0x1F;
    public static final int SEEN = 1;

    private static final String HEADER_END = "\r\n\r\n";

    private final EmailMapper emailMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * Emails where the user is a recipient, oldest first. \Seen is set for read messages.
     */
    public List<MailboxEntry> loadMessages(String userId, int limit) {
        List<MailboxEntry> entries = emailMapper.findMailboxEntries(userId, limit);
        for (MailboxEntry entry : entries) {
            if (entry.isRead()) {
                entry.setFlags(entry.getFlags() | SEEN);
            }
        }
        log.info("Loaded {} messages for user {}", entries.size(), userId);
        return entries;
    }

    /**
     * Full RFC 822 text of a stored message
     *
     * @throws MessageAccessException if the email does not exist or is not visible to the user
     */
    public String renderMessage(String emailId, String userId) {
        Email email = emailMapper.findByIdForUser(emailId, userId);
        if (email == null) {
            log.warn("Email not found or access denied: {} for user {}", emailId, userId);
            throw new MessageAccessException("Email not found or access denied");
        }
        email.setRecipients(emailMapper.findRecipients(emailId));
        email.setAttachments(emailMapper.findAttachments(emailId));

        try {
            MimeMessage message = buildMessage(email, userId);
            return new String(EmlParser.toBytes(message), StandardCharsets.UTF_8);
        } catch (MessagingException | IOException e) {
            throw new MessageAccessException("Failed to render email " + emailId, e);
        }
    }

    /**
     * Header block of the rendered message, without the terminating blank line
     */
    public String renderHeaders(String emailId, String userId) {
        String message = renderMessage(emailId, userId);
        int headerEnd = message.indexOf(HEADER_END);
        return headerEnd < 0 ? message : message.substring(0, headerEnd);
    }

    /**
     * Headers, a blank line, then at most {@code lines} lines of the body
     */
    public String renderTop(String emailId, String userId, int lines) {
        String message = renderMessage(emailId, userId);
        int headerEnd = message.indexOf(HEADER_END);
        if (headerEnd < 0) {
            return message;
        }
        String headers = message.substring(0, headerEnd);
        if (lines <= 0) {
            return headers + HEADER_END;
        }

        String[] bodyLines = message.substring(headerEnd + HEADER_END.length()).split("\r\n", -1);
        int count = Math.min(lines, bodyLines.length);
        return headers + HEADER_END + String.join("\r\n", Arrays.copyOf(bodyLines, count));
    }

    public void updateFlags(String emailId, String userId, int flags) {
        int persisted = flags & PERSISTED_FLAGS;
        emailMapper.updateRecipientFlags(emailId, userId, persisted, (persisted & SEEN) != 0);
    }

    public void markSeen(String emailId, String userId) {
        emailMapper.markSeen(emailId, userId);
    }

    /**
     * Remove each email with its recipient and attachment rows
     */
    public void applyDeletions(Collection<String> emailIds) {
        for (String emailId : emailIds) {
            transactionTemplate.executeWithoutResult(status -> {
                emailMapper.deleteRecipients(emailId);
                emailMapper.deleteAttachments(emailId);
                emailMapper.deleteById(emailId);
            });
            log.info("Deleted email: {}", emailId);
        }
    }

    private MimeMessage buildMessage(Email email, String viewerUserId) throws MessagingException, UnsupportedEncodingException {
        MimeMessage message = EmlParser.newMessage(EmlParser.getSession(), email.getMessageId());
        message.setFrom(new InternetAddress(email.getFromAddress(), email.getFromDisplayName(), "UTF-8"));

        for (EmailRecipient recipient : email.getRecipients()) {
            InternetAddress address = new InternetAddress(recipient.getAddress(), recipient.getDisplayName(), "UTF-8");
            switch (recipient.getType()) {
                case TO -> message.addRecipient(Message.RecipientType.TO, address);
                case CC -> message.addRecipient(Message.RecipientType.CC, address);
                case BCC -> {
                    // Blind copies are only shown to the recipient they were addressed to
                    if (viewerUserId.equals(recipient.getUserId())) {
                        message.addRecipient(Message.RecipientType.BCC, address);
                    }
                }
            }
        }

        message.setSubject(email.getSubject(), "UTF-8");
        if (email.getReceivedAt() != null) {
            message.setSentDate(Date.from(email.getReceivedAt()));
        }
        if (email.getInReplyTo() != null) {
            message.setHeader("In-Reply-To", email.getInReplyTo());
        }
        if (email.getReferences() != null) {
            message.setHeader("References", email.getReferences());
        }

        List<MimeBodyPart> attachments = new ArrayList<>();
        for (EmailAttachment attachment : email.getAttachments()) {
            attachments.add(EmlParser.attachmentPart(
                    attachment.getFileName(), attachment.getContentType(), attachment.getContent()));
        }
        EmlParser.setBody(message, email.getTextBody(), email.getHtmlBody(), attachments);
        message.saveChanges();
        return message;
    }
}
