package com.dailyfin.backend.notifications.provider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import com.dailyfin.backend.config.PushProperties;
import com.dailyfin.backend.notifications.PushNotification;

import lombok.extern.slf4j.Slf4j;

/**
 * Envia notificações a um gateway HTTP de push (um POST por token).
 * Respostas 404/410 indicam token expirado ou desinstalado.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.push.enabled", havingValue = "true")
public class HttpPushProvider implements PushProviderClient {

    private final RestClient restClient;
    private final PushProperties properties;

    public HttpPushProvider(PushProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = properties.timeoutSeconds() * 1000;
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);

        this.restClient = RestClient.builder()
                .baseUrl(properties.gatewayUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public DeliveryReport send(List<String> tokens, PushNotification notification) {
        int success = 0;
        List<String> invalid = new ArrayList<>();

        for (String token : tokens) {
            try {
                restClient.post()
                        .uri("/send")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer " + properties.apiKey())
                        .body(payload(token, notification))
                        .retrieve()
                        .toBodilessEntity();
                success++;
            } catch (RestClientResponseException e) {
                if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)
                        || e.getStatusCode().isSameCodeAs(HttpStatus.GONE)) {
                    invalid.add(token);
                } else {
                    log.warn("[Notification] Gateway respondeu {} para um token", e.getStatusCode().value());
                }
            }
        }

        return new DeliveryReport(success, invalid);
    }

    private static Map<String, Object> payload(String token, PushNotification notification) {
        Map<String, String> data = new HashMap<>();
        if (notification.getData() != null) {
            data.putAll(notification.getData());
        }
        data.put("type", notification.getType().name().toLowerCase());

        return Map.of(
                "token", token,
                "notification", Map.of(
                        "title", notification.getTitle(),
                        "body", notification.getBody()
                ),
                "data", data
        );
    }
}
