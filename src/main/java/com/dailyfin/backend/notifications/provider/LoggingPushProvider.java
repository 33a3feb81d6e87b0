package com.dailyfin.backend.notifications.provider;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.dailyfin.backend.notifications.PushNotification;

import lombok.extern.slf4j.Slf4j;

/**
 * Provedor usado quando o push está desativado: apenas registra a notificação.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.push.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingPushProvider implements PushProviderClient {

    @Override
    public DeliveryReport send(List<String> tokens, PushNotification notification) {
        log.info("[Notification] Push desativado. {} para {} dispositivo(s): {}",
                notification.getType(), tokens.size(), notification.getBody());
        return DeliveryReport.none();
    }
}
