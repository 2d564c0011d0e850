package com.relaymail.domain;

public enum OutboundRecipientStatus {
    PENDING,
    SENT,
    FAILED,
    DEFERRED
}
