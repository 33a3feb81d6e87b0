package com.dailyfin.backend.security;

import java.util.UUID;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Identidade do usuário autenticado na requisição atual. Toda consulta de dados
 * é filtrada pelo id retornado aqui.
 */
@Component("securityService")
public class SecurityService {

    public CustomUserDetails getCurrentUser() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth == null || !auth.isAuthenticated()
                || !(auth.getPrincipal() instanceof CustomUserDetails details)) {
            throw new AuthenticationCredentialsNotFoundException("Usuário não autenticado");
        }
        return details;
    }

    public UUID getCurrentUserId() {
        return getCurrentUser().getId();
    }
}
