package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.PushNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.stereotype.Service;

/**
 * Pushes to the recipient's STOMP user queue. A recipient with no connected session
 * is a failed delivery, not a silent drop.
 */
@Slf4j
@Service
public class StompPushNotificationDispatcher implements PushNotificationDispatcher {

    public static final String NOTIFICATION_QUEUE = "/queue/notifications";

    private final SimpMessagingTemplate messagingTemplate;
    private final SimpUserRegistry userRegistry;

    @Autowired
    public StompPushNotificationDispatcher(SimpMessagingTemplate messagingTemplate, SimpUserRegistry userRegistry) {
        this.messagingTemplate = messagingTemplate;
        this.userRegistry = userRegistry;
    }

    @Override
    public void send(PushNotification notification, String recipientId) {
        if (userRegistry.getUser(recipientId) == null) {
            throw new MessageDeliveryException("No connected session for user " + recipientId);
        }
        messagingTemplate.convertAndSendToUser(recipientId, NOTIFICATION_QUEUE, notification);
        log.debug("📨 Sent {} to {}", notification.getType(), recipientId);
    }
}
