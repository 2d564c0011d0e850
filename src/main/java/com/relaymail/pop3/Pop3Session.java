package com.relaymail.pop3;

import com.relaymail.protocol.ProtocolSession;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * POP3 session context
 * DELE only marks messages here; nothing reaches the store before QUIT.
 */
@Getter
@Setter
public class Pop3Session extends ProtocolSession {

    public static final int MAX_DELETED_MESSAGES = 10000;

    private Pop3State state = Pop3State.AUTHORIZATION;
    private String pendingUsername; // from USER, consumed by PASS

    private List<Pop3Message> messages = new ArrayList<>();
    private Set<Integer> deletedNumbers = new TreeSet<>();

    /**
     * @return the message, or null if the number is out of range
     */
    public Pop3Message getMessage(int number) {
        if (number < 1 || number > messages.size()) {
            return null;
        }
        return messages.get(number - 1);
    }

    public boolean isDeleted(int number) {
        return deletedNumbers.contains(number);
    }

    /**
     * @return false when the deletion limit is reached
     */
    public boolean markDeleted(int number) {
        if (deletedNumbers.size() >= MAX_DELETED_MESSAGES) {
            return false;
        }
        return deletedNumbers.add(number);
    }

    public void resetDeletions() {
        deletedNumbers.clear();
    }

    public List<Pop3Message> getActiveMessages() {
        return messages.stream().filter(m -> !isDeleted(m.getNumber())).collect(Collectors.toList());
    }

    public List<String> getDeletedEmailIds() {
        return deletedNumbers.stream().map(n -> messages.get(n - 1).getEmailId()).collect(Collectors.toList());
    }
}
