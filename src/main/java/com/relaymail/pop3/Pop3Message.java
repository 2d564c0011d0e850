package com.relaymail.pop3;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Maildrop entry, numbered from 1 for the whole session
 */
@Data
@AllArgsConstructor
public class Pop3Message {

    private int number;
    private String emailId;
    private long sizeBytes;
}
