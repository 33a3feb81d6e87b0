package com.dailyfin.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.push")
public record PushProperties(
        boolean enabled,
        String gatewayUrl,
        String apiKey,
        int timeoutSeconds
) {
    public PushProperties {
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            gatewayUrl = "http://localhost:8085";
        }
        if (apiKey == null) {
            apiKey = "";
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = 5;
        }
    }
}
