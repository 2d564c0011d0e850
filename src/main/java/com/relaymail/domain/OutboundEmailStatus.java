package com.relaymail.domain;

/**
 * Lifecycle of a message sent by a local user
 */
public enum OutboundEmailStatus {
    /** Not yet submitted */
    DRAFT,
    /** Waiting for the delivery processor (first attempt or retry) */
    QUEUED,
    /** Picked up by the delivery processor */
    SENDING,
    /** Every recipient accepted */
    SENT,
    /** Some recipients accepted, others failed. Not retried */
    PARTIAL_FAILURE,
    /** Every recipient failed and the retry budget is exhausted */
    FAILED
}
