package com.dailyfin.backend.realtime;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Usuários conectados ao canal em tempo real. Um usuário pode ter várias sessões
 * (abas, dispositivos) e só fica offline quando a última é encerrada.
 */
@Component
public class PresenceRegistry {

    private final Map<UUID, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    /** @return true se esta é a primeira sessão do usuário (transição para online). */
    public boolean connect(UUID userId, String sessionId) {
        boolean[] firstSession = {false};
        sessionsByUser.compute(userId, (id, sessions) -> {
            if (sessions == null) {
                sessions = ConcurrentHashMap.newKeySet();
                firstSession[0] = true;
            }
            sessions.add(sessionId);
            return sessions;
        });
        return firstSession[0];
    }

    /** @return true se era a última sessão do usuário (transição para offline). */
    public boolean disconnect(UUID userId, String sessionId) {
        boolean[] lastSession = {false};
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            sessions.remove(sessionId);
            if (sessions.isEmpty()) {
                lastSession[0] = true;
                return null;
            }
            return sessions;
        });
        return lastSession[0];
    }

    public boolean isOnline(UUID userId) {
        return userId != null && sessionsByUser.containsKey(userId);
    }

    public Set<UUID> onlineUsers() {
        return Collections.unmodifiableSet(sessionsByUser.keySet());
    }
}
