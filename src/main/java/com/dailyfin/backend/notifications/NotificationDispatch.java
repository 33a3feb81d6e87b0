package com.dailyfin.backend.notifications;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envolve o disparo de uma notificação para que uma recusa síncrona
 * (fila do executor cheia, por exemplo) não chegue à operação principal.
 */
public final class NotificationDispatch {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatch.class);

    private NotificationDispatch() {
    }

    /** Retorna false se o envio não pôde ser agendado. */
    public static boolean dispatch(String context, Runnable send) {
        try {
            send.run();
            return true;
        } catch (RuntimeException ex) {
            logger.warn("[Notification] Envio descartado ({}): {}", context, ex.getMessage());
            return false;
        }
    }
}
