package com.dailyfin.backend.realtime;

import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Component;

import com.dailyfin.backend.security.CustomUserDetails;
import com.dailyfin.backend.security.CustomUserDetailsService;
import com.dailyfin.backend.security.JwtService;

import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Autentica o frame CONNECT com o mesmo JWT da API REST
 * (cabeçalho nativo {@code Authorization: Bearer <token>}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompAuthChannelInterceptor implements ChannelInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final CustomUserDetailsService userDetailsService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String header = accessor.getFirstNativeHeader("Authorization");
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new MessagingException("Token de autenticação ausente");
        }

        String token = header.substring(BEARER_PREFIX.length());
        try {
            String email = jwtService.extractUsername(token);
            CustomUserDetails user = (CustomUserDetails) userDetailsService.loadUserByUsername(email);
            if (!jwtService.isTokenValid(token, user)) {
                throw new MessagingException("Token inválido");
            }
            accessor.setUser(new StompPrincipal(user.getId(), user.getUsername()));
            log.debug("[WebSocket] CONNECT autenticado para {}", user.getId());
        } catch (JwtException | IllegalArgumentException | UsernameNotFoundException e) {
            log.warn("[WebSocket] CONNECT recusado: {}", e.getMessage());
            throw new MessagingException("Token inválido ou expirado", e);
        }

        return message;
    }
}
