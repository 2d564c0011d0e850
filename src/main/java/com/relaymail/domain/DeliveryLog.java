package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One delivery attempt for one recipient against one host. Rows are append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryLog {

    private String id;
    private String outboundEmailId;
    private String recipientId;
    private String recipientAddress;
    private String mxHost;
    private Integer smtpStatusCode;
    private String smtpResponse;
    private boolean success;
    private String errorMessage;
    private int attemptNumber;
    private Instant attemptedAt;
    private long durationMs;
}
