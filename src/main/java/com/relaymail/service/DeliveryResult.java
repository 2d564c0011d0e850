package com.relaymail.service;

import java.time.Duration;

/**
 * Outcome of one delivery attempt for one recipient against one host
 */
public record DeliveryResult(String recipientId,
                             String address,
                             boolean success,
                             String mxHost,
                             Integer smtpStatusCode,
                             String smtpResponse,
                             String errorMessage,
                             Duration duration) {

    public static DeliveryResult delivered(String recipientId, String address, String mxHost,
                                           Integer statusCode, String response, Duration duration) {
        return new DeliveryResult(recipientId, address, true, mxHost, statusCode, response, null, duration);
    }

    public static DeliveryResult failed(String recipientId, String address, String mxHost,
                                        Integer statusCode, String response, String error, Duration duration) {
        return new DeliveryResult(recipientId, address, false, mxHost, statusCode, response, error, duration);
    }
}
