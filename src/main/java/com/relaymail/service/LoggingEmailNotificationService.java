package com.relaymail.service;

import com.relaymail.domain.Email;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;

@Slf4j
@Service
public class LoggingEmailNotificationService implements EmailNotificationService {

    @Override
    public void notifyNewEmail(Collection<String> userIds, Email email) {
        log.info("New email {} for users {}", email.getMessageId(), userIds);
    }
}
