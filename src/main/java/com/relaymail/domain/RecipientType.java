package com.relaymail.domain;

public enum RecipientType {
    TO,
    CC,
    BCC
}
