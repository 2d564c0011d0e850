package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recipient of an inbound message. userId is set when the address belongs to a local user;
 * flags holds that user's IMAP flag bitmask for the message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailRecipient {

    private String id;
    private String emailId;
    private String address;
    private String displayName;
    private RecipientType type;
    private String userId;
    private boolean read;
    private int flags;
}
