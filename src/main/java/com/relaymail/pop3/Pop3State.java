package com.relaymail.pop3;

/**
 * POP3 session states (RFC 1939)
 */
public enum Pop3State {
    /** USER / PASS expected */
    AUTHORIZATION,
    /** Logged in, maildrop listing fixed for the session */
    TRANSACTION,
    /** QUIT received, deletions being committed */
    UPDATE
}
