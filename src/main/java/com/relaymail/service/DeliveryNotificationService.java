package com.relaymail.service;

import com.relaymail.domain.OutboundEmailStatus;

/**
 * Observer told whenever an outbound email changes delivery status
 */
public interface DeliveryNotificationService {

    void notifyDeliveryStatusChanged(String userId, String outboundEmailId, OutboundEmailStatus status);
}
