package com.relaymail.service;

import com.relaymail.domain.OutboundEmailStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class LoggingDeliveryNotificationService implements DeliveryNotificationService {

    @Override
    public void notifyDeliveryStatusChanged(String userId, String outboundEmailId, OutboundEmailStatus status) {
        log.info("Outbound email {} of user {} is now {}", outboundEmailId, userId, status);
    }
}
