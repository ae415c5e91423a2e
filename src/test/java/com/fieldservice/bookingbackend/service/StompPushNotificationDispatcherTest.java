package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.PushNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUser;
import org.springframework.messaging.simp.user.SimpUserRegistry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StompPushNotificationDispatcherTest {

    private SimpMessagingTemplate messagingTemplate;
    private SimpUserRegistry userRegistry;
    private StompPushNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        userRegistry = mock(SimpUserRegistry.class);
        dispatcher = new StompPushNotificationDispatcher(messagingTemplate, userRegistry);
    }

    @Test
    void testSend_connectedUser() {
        when(userRegistry.getUser("pro1")).thenReturn(mock(SimpUser.class));
        PushNotification notification = PushNotification.subscriptionAdded("cust1", "pro1");

        dispatcher.send(notification, "pro1");

        verify(messagingTemplate, times(1))
                .convertAndSendToUser("pro1", "/queue/notifications", notification);
    }

    @Test
    void testSend_noConnectedSessionFails() {
        PushNotification notification = PushNotification.locationUpdate("pro1", 1, 2);

        assertThrows(MessageDeliveryException.class, () -> dispatcher.send(notification, "cust1"));
        verify(messagingTemplate, never()).convertAndSendToUser(anyString(), anyString(), any());
    }

    @Test
    void testSend_transportFailurePropagates() {
        when(userRegistry.getUser("s2")).thenReturn(mock(SimpUser.class));
        PushNotification notification = PushNotification.locationUpdate("pro1", 1, 2);
        doThrow(new MessageDeliveryException("closed"))
                .when(messagingTemplate).convertAndSendToUser("s2", "/queue/notifications", notification);

        assertThrows(MessageDeliveryException.class, () -> dispatcher.send(notification, "s2"));
    }
}
