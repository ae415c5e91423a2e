package com.fieldservice.bookingbackend.filter;

import com.fieldservice.bookingbackend.util.JwtUtil;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class JwtAuthenticationFilterTest {

    private static final String SECRET = "test-secret-for-unit-tests-only-0123456789abcdef";

    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(new JwtUtil(SECRET));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private String token(String secret, String subject, String role, Date expiration) {
        return Jwts.builder()
                .subject(subject)
                .claim("role", role)
                .expiration(expiration)
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    private MockFilterChain run(String authorization) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/location/nearby");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return chain;
    }

    @Test
    void testValidToken_setsUserIdAndRoleAuthority() throws Exception {
        String jwt = token(SECRET, "pro1", "professional", new Date(System.currentTimeMillis() + 60_000));

        MockFilterChain chain = run("Bearer " + jwt);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertNotNull(authentication);
        assertEquals("pro1", authentication.getName());
        assertEquals("PROFESSIONAL", authentication.getAuthorities().iterator().next().getAuthority());
        assertNotNull(chain.getRequest());
    }

    @Test
    void testTokenSignedWithOtherKey_leavesRequestAnonymous() throws Exception {
        String jwt = token("another-secret-that-is-long-enough-0123456789", "pro1", "professional",
                new Date(System.currentTimeMillis() + 60_000));

        MockFilterChain chain = run("Bearer " + jwt);

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }

    @Test
    void testExpiredToken_leavesRequestAnonymous() throws Exception {
        String jwt = token(SECRET, "pro1", "professional", new Date(System.currentTimeMillis() - 60_000));

        run("Bearer " + jwt);

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void testNoHeader() throws Exception {
        MockFilterChain chain = run(null);

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }
}
