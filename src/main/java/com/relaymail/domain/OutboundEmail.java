package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Message composed by a local user and handed to the delivery processor
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundEmail {

    private String id;
    private String userId;
    private String fromAddress;
    private String fromDisplayName;
    private String subject;
    private String textBody;
    private String htmlBody;
    @Builder.Default
    private OutboundEmailStatus status = OutboundEmailStatus.DRAFT;

    // Threading headers
    private String inReplyTo;
    private String references;
    private String messageId;

    private Instant createdAt;
    private Instant queuedAt;
    private Instant sentAt;

    // Retry state
    private int retryCount;
    private Instant nextRetryAt;
    private String lastError;

    @Builder.Default
    private List<OutboundRecipient> recipients = new ArrayList<>();
    @Builder.Default
    private List<OutboundAttachment> attachments = new ArrayList<>();
}
