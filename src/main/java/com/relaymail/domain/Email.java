package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound message accepted over SMTP
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Email {

    private String id;
    private String messageId;
    private String fromAddress;
    private String fromDisplayName;
    private String subject;
    private String textBody;
    private String htmlBody;
    private Instant receivedAt;
    private long sizeBytes;

    // Threading
    private String inReplyTo;
    private String references;
    private String threadId;

    private String sentByUserId;

    @Builder.Default
    private List<EmailRecipient> recipients = new ArrayList<>();
    @Builder.Default
    private List<EmailAttachment> attachments = new ArrayList<>();
}
