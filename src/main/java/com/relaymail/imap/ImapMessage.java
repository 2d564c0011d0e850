package com.relaymail.imap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Message summary in a session's view of the selected mailbox
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImapMessage {

    /** 1-based position in the current view, changes on EXPUNGE */
    private int sequenceNumber;
    private long uid;
    private String emailId;
    private long sizeBytes;
    private String messageId;
    private int flags;
    private Instant internalDate;

    /**
     * Stable UID for a stored email: the top 31 bits of the id's UUID, never 0
     */
    public static long uidFor(String emailId) {
        long uid;
        try {
            uid = UUID.fromString(emailId).getMostSignificantBits() >>> 33;
        } catch (IllegalArgumentException e) {
            uid = emailId.hashCode() & 0x7FFFFFFFL;
        }
        return uid == 0 ? 1 : uid;
    }

    public boolean hasFlag(int flag) {
        return ImapFlags.has(flags, flag);
    }
}
