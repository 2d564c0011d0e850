package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One message in a user's INBOX listing, with that user's flag state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailboxEntry {

    private String emailId;
    private String messageId;
    private long sizeBytes;
    private Instant receivedAt;
    private int flags;
    private boolean read;
}
