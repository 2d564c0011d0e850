package com.relaymail.imap;

import com.relaymail.protocol.ProtocolSession;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * IMAP session context
 * State for a single IMAP client connection
 */
@Getter
@Setter
public class ImapSession extends ProtocolSession {

    /** Same for every session of this process, changes on restart */
    public static final long UID_VALIDITY = Math.max(1L, Instant.now().getEpochSecond() & 0xFFFFFFFFL);

    public static final int MAX_DELETED_UIDS = 10000;

    private ImapState state = ImapState.NOT_AUTHENTICATED;

    // AUTHENTICATE PLAIN waiting for the client response
    private String pendingAuthTag;

    // Selected mailbox
    private String selectedMailbox;
    private boolean readOnly = false; // true when opened with EXAMINE
    private List<ImapMessage> messages = new ArrayList<>();
    private Set<Long> deletedUids = new LinkedHashSet<>();

    private Set<String> enabledCapabilities = new LinkedHashSet<>();

    public long getUidValidity() {
        return UID_VALIDITY;
    }

    /**
     * SELECT / EXAMINE. Messages already flagged \Deleted are pending expunge.
     */
    public void selectMailbox(String mailbox, boolean readOnly, List<ImapMessage> messages) {
        this.selectedMailbox = mailbox;
        this.readOnly = readOnly;
        this.messages = new ArrayList<>(messages);
        this.deletedUids.clear();
        renumber();
        for (ImapMessage message : this.messages) {
            if (message.hasFlag(ImapFlags.DELETED)) {
                markDeleted(message.getUid());
            }
        }
        this.state = ImapState.SELECTED;
    }

    /**
     * CLOSE / UNSELECT
     */
    public void closeMailbox() {
        this.selectedMailbox = null;
        this.readOnly = false;
        this.messages = new ArrayList<>();
        this.deletedUids.clear();
        this.state = ImapState.AUTHENTICATED;
    }

    /**
     * @return false if the message is not tracked yet and the limit is reached
     */
    public boolean markDeleted(long uid) {
        if (deletedUids.contains(uid)) {
            return true;
        }
        if (deletedUids.size() >= MAX_DELETED_UIDS) {
            return false;
        }
        deletedUids.add(uid);
        return true;
    }

    public void unmarkDeleted(long uid) {
        deletedUids.remove(uid);
    }

    public boolean isPendingDeletion(long uid) {
        return deletedUids.contains(uid);
    }

    public ImapMessage getMessageBySequence(int sequence) {
        if (sequence < 1 || sequence > messages.size()) {
            return null;
        }
        return messages.get(sequence - 1);
    }

    public ImapMessage getMessageByUid(long uid) {
        return messages.stream()
                .filter(m -> m.getUid() == uid)
                .findFirst()
                .orElse(null);
    }

    public long getMaxUid() {
        return messages.stream().mapToLong(ImapMessage::getUid).max().orElse(0L);
    }

    public long getUidNext() {
        return getMaxUid() + 1;
    }

    /**
     * Remove the given messages from the view and renumber the rest.
     *
     * @return the removed sequence numbers, highest first
     */
    public List<Integer> removeMessages(Set<Long> uids) {
        List<Integer> removed = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0; i--) {
            ImapMessage message = messages.get(i);
            if (uids.contains(message.getUid())) {
                removed.add(message.getSequenceNumber());
                messages.remove(i);
                deletedUids.remove(message.getUid());
            }
        }
        renumber();
        return removed;
    }

    private void renumber() {
        for (int i = 0; i < messages.size(); i++) {
            messages.get(i).setSequenceNumber(i + 1);
        }
    }
}
