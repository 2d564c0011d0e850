package com.relaymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundRecipient {

    private String id;
    private String outboundEmailId;
    private String address;
    private String displayName;
    private RecipientType type;
    @Builder.Default
    private OutboundRecipientStatus status = OutboundRecipientStatus.PENDING;
    private String statusMessage;
    private Instant deliveredAt;

    public boolean isAwaitingDelivery() {
        return status == OutboundRecipientStatus.PENDING || status == OutboundRecipientStatus.DEFERRED;
    }
}
