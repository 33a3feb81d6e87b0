package com.dailyfin.backend.notifications.provider;

import java.util.List;

import com.dailyfin.backend.notifications.PushNotification;

public interface PushProviderClient {

    DeliveryReport send(List<String> tokens, PushNotification notification);

    record DeliveryReport(int successCount, List<String> invalidTokens) {

        public static DeliveryReport none() {
            return new DeliveryReport(0, List.of());
        }
    }
}
