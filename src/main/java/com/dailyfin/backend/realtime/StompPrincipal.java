package com.dailyfin.backend.realtime;

import java.security.Principal;
import java.util.UUID;

/**
 * Identidade de uma sessão STOMP. O nome é o id do usuário, que é a chave usada
 * pelos destinos {@code /user/...}.
 */
public record StompPrincipal(UUID userId, String email) implements Principal {

    @Override
    public String getName() {
        return userId.toString();
    }
}
