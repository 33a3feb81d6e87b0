package com.dailyfin.backend.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Date;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.enums.Role;

import io.jsonwebtoken.ExpiredJwtException;

class JwtServiceTest {

    private JwtService jwtService;
    private User user;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService();
        // HS256 requires a sufficiently long key; use 32+ bytes.
        ReflectionTestUtils.setField(jwtService, "secret", "01234567890123456789012345678901");
        ReflectionTestUtils.setField(jwtService, "expirationMillis", 900_000L);
        ReflectionTestUtils.setField(jwtService, "refreshExpirationMillis", 604_800_000L);

        user = new User();
        user.setId(UUID.randomUUID());
        user.setName("Rahim");
        user.setEmail("rahim@dailyfin.app");
        user.setRole(Role.USER);
    }

    @Test
    void generateToken_carriesIdentityAndUsesAccessExpiration() {
        String token = jwtService.generateToken(user);
        assertNotNull(token);

        assertEquals("rahim@dailyfin.app", jwtService.extractUsername(token));
        assertEquals(user.getId(), jwtService.extractUserId(token));
        assertFalse(jwtService.isRefreshToken(token));

        Date issuedAt = jwtService.extractClaim(token, c -> c.getIssuedAt());
        Date expiration = jwtService.extractClaim(token, c -> c.getExpiration());
        long deltaMs = expiration.getTime() - issuedAt.getTime();
        assertTrue(Math.abs(deltaMs - 900_000L) < 2_000L, "access token expiration should be ~15min");
    }

    @Test
    void generateRefreshToken_isMarkedAndRejectedAsAccessToken() {
        String refresh = jwtService.generateRefreshToken(user);

        assertTrue(jwtService.isRefreshToken(refresh));
        assertEquals(user.getId(), jwtService.extractUserId(refresh));
        assertFalse(jwtService.isTokenValid(refresh, CustomUserDetails.from(user)));
    }

    @Test
    void isTokenValid_acceptsAccessTokenForSameUserOnly() {
        String token = jwtService.generateToken(user);

        User other = new User();
        other.setId(UUID.randomUUID());
        other.setEmail("outra@dailyfin.app");
        other.setRole(Role.USER);

        assertTrue(jwtService.isTokenValid(token, CustomUserDetails.from(user)));
        assertFalse(jwtService.isTokenValid(token, CustomUserDetails.from(other)));
    }

    @Test
    void expiredToken_failsToParse() {
        ReflectionTestUtils.setField(jwtService, "expirationMillis", -1_000L);
        String token = jwtService.generateToken(user);

        assertThrows(ExpiredJwtException.class, () -> jwtService.extractUsername(token));
    }
}
