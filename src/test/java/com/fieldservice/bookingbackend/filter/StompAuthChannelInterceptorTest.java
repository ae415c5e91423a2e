package com.fieldservice.bookingbackend.filter;

import com.fieldservice.bookingbackend.util.JwtUtil;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class StompAuthChannelInterceptorTest {

    private static final String SECRET = "test-secret-for-unit-tests-only-0123456789abcdef";

    private StompAuthChannelInterceptor interceptor;
    private MessageChannel channel;

    @BeforeEach
    void setUp() {
        interceptor = new StompAuthChannelInterceptor(new JwtUtil(SECRET));
        channel = mock(MessageChannel.class);
    }

    private String token(String subject, String role) {
        return Jwts.builder()
                .subject(subject)
                .claim("role", role)
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    private Message<byte[]> frame(StompCommand command, String authorization, String destination, Principal user) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        if (authorization != null) {
            accessor.setNativeHeader("Authorization", authorization);
        }
        if (destination != null) {
            accessor.setDestination(destination);
        }
        accessor.setUser(user);
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    void testConnect_validTokenSetsSessionUser() {
        Message<?> result = interceptor.preSend(
                frame(StompCommand.CONNECT, "Bearer " + token("cust1", "customer"), null, null), channel);

        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(result, StompHeaderAccessor.class);
        assertNotNull(accessor.getUser());
        assertEquals("cust1", accessor.getUser().getName());
    }

    @Test
    void testConnect_missingTokenRejected() {
        assertThrows(MessagingException.class,
                () -> interceptor.preSend(frame(StompCommand.CONNECT, null, null, null), channel));
    }

    @Test
    void testConnect_badTokenRejected() {
        assertThrows(MessagingException.class,
                () -> interceptor.preSend(frame(StompCommand.CONNECT, "Bearer not-a-jwt", null, null), channel));
    }

    @Test
    void testSubscribe_locationTopicRequiresUser() {
        assertThrows(MessagingException.class, () -> interceptor.preSend(
                frame(StompCommand.SUBSCRIBE, null, "/topic/locations/pro1", null), channel));
    }

    @Test
    void testSubscribe_authenticatedSessionAllowed() {
        Principal user = new UsernamePasswordAuthenticationToken("cust1", null, List.of());

        assertDoesNotThrow(() -> interceptor.preSend(
                frame(StompCommand.SUBSCRIBE, null, "/topic/locations/pro1", user), channel));
    }
}
