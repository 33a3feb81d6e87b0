package com.dailyfin.backend.realtime;

import java.security.Principal;

import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import com.dailyfin.backend.dto.chat.PresenceEventDTO;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mantém o {@link PresenceRegistry} e anuncia em {@code /topic/presence}
 * quando um usuário fica online (primeira sessão) ou offline (última sessão).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceEventListener {

    public static final String PRESENCE_TOPIC = "/topic/presence";

    private final PresenceRegistry presenceRegistry;
    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        StompPrincipal principal = asStompPrincipal(event.getUser());
        if (principal == null) return;

        String sessionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        if (presenceRegistry.connect(principal.userId(), sessionId)) {
            log.info("[Presence] Usuário {} online", principal.userId());
            messagingTemplate.convertAndSend(PRESENCE_TOPIC, new PresenceEventDTO(principal.userId(), true));
        }
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        StompPrincipal principal = asStompPrincipal(event.getUser());
        if (principal == null) return;

        if (presenceRegistry.disconnect(principal.userId(), event.getSessionId())) {
            log.info("[Presence] Usuário {} offline", principal.userId());
            messagingTemplate.convertAndSend(PRESENCE_TOPIC, new PresenceEventDTO(principal.userId(), false));
        }
    }

    private static StompPrincipal asStompPrincipal(Principal user) {
        return user instanceof StompPrincipal stomp ? stomp : null;
    }
}
