package com.fieldservice.bookingbackend.filter;

import com.fieldservice.bookingbackend.util.JwtUtil;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authenticates STOMP sessions. CONNECT must carry the same bearer token as the REST API;
 * the token subject becomes the session user, which is what user destinations resolve against.
 */
@Slf4j
@Component
public class StompAuthChannelInterceptor implements ChannelInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtUtil jwtUtil;

    public StompAuthChannelInterceptor(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            return message;
        }

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            accessor.setUser(authenticate(accessor.getFirstNativeHeader(HttpHeaders.AUTHORIZATION)));
        } else if (StompCommand.SUBSCRIBE.equals(accessor.getCommand()) && accessor.getUser() == null) {
            log.warn("🚫 Unauthenticated subscribe to {}", accessor.getDestination());
            throw new MessagingException("Authentication required to subscribe to " + accessor.getDestination());
        }
        return message;
    }

    private UsernamePasswordAuthenticationToken authenticate(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new MessagingException("Missing bearer token on STOMP CONNECT");
        }
        try {
            Claims claims = jwtUtil.parseClaims(header.substring(BEARER_PREFIX.length()));
            String userId = jwtUtil.extractUserId(claims);
            String role = jwtUtil.extractRole(claims);
            if (userId == null || role == null) {
                throw new MessagingException("Token has no subject or role");
            }
            return new UsernamePasswordAuthenticationToken(userId, null, List.of(new SimpleGrantedAuthority(role)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected STOMP CONNECT token: {}", e.getMessage());
            throw new MessagingException("Invalid bearer token on STOMP CONNECT", e);
        }
    }
}
