package com.dailyfin.backend.security;

import com.dailyfin.backend.entities.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

@Service
public class JwtService {

    static final String CLAIM_ID = "id";
    static final String CLAIM_TYPE = "type";
    static final String REFRESH_TYPE = "refresh";

    @Value("${jwt.secret}")
    private String secret;

    @Getter
    @Value("${jwt.expiration}")
    private Long expirationMillis;

    @Getter
    @Value("${jwt.refreshExpiration:604800000}")
    private Long refreshExpirationMillis;

    public String generateToken(User user) {
        return buildToken(Map.of(
                CLAIM_ID, user.getId().toString(),
                "name", user.getName(),
                "role", user.getRole().name()
        ), user.getEmail(), expirationMillis);
    }

    public String generateRefreshToken(User user) {
        return buildToken(Map.of(
                CLAIM_ID, user.getId().toString(),
                "role", user.getRole().name(),
                CLAIM_TYPE, REFRESH_TYPE
        ), user.getEmail(), refreshExpirationMillis);
    }

    private String buildToken(Map<String, Object> extraClaims, String subject, long ttlMillis) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + ttlMillis);

        return Jwts.builder()
                .setClaims(extraClaims)
                .setSubject(subject)
                .setIssuedAt(now)
                .setExpiration(expiryDate)
                .signWith(getSigningKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public UUID extractUserId(String token) {
        String id = extractClaim(token, claims -> claims.get(CLAIM_ID, String.class));
        return id != null ? UUID.fromString(id) : null;
    }

    // Token de acesso válido: assinatura ok, não expirado, mesmo usuário e não é refresh
    public boolean isTokenValid(String token, UserDetails userDetails) {
        String username = extractUsername(token);
        return username.equals(userDetails.getUsername())
                && !isTokenExpired(token)
                && !isRefreshToken(token);
    }

    public boolean isRefreshToken(String token) {
        return REFRESH_TYPE.equals(extractClaim(token, claims -> claims.get(CLAIM_TYPE, String.class)));
    }

    private boolean isTokenExpired(String token) {
        Date expiration = extractClaim(token, Claims::getExpiration);
        return expiration.before(new Date());
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    private Claims extractAllClaims(String token) {
        return Jwts
                .parserBuilder()
                .setSigningKey(getSigningKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private Key getSigningKey() {
        // usa o secret como string normal (não Base64)
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
