package com.relaymail.imap;

/**
 * IMAP session state machine
 */
public enum ImapState {
    /** Greeting sent, waiting for LOGIN / AUTHENTICATE */
    NOT_AUTHENTICATED,
    /** Logged in, no mailbox selected */
    AUTHENTICATED,
    /** INBOX selected with SELECT or EXAMINE */
    SELECTED,
    /** BYE sent, channel closing */
    LOGOUT
}
