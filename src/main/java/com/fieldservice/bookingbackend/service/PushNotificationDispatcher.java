package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.PushNotification;

/**
 * Delivers push messages to users. Token registration and platform delivery live behind this seam.
 */
public interface PushNotificationDispatcher {

    /**
     * @throws RuntimeException when the message could not be handed to the transport
     */
    void send(PushNotification notification, String recipientId);
}
