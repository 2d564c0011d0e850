package com.relaymail.service;

import com.relaymail.domain.Email;

import java.util.Collection;

/**
 * Observer told about newly stored mail, e.g. to push a "new mail" event to clients
 */
public interface EmailNotificationService {

    void notifyNewEmail(Collection<String> userIds, Email email);
}
