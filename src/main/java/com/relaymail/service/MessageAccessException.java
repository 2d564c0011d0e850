package com.relaymail.service;

/**
 * A stored message could not be read or rendered for the requesting user
 */
public class MessageAccessException extends RuntimeException {

    public MessageAccessException(String message) {
        super(message);
    }

    public MessageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
