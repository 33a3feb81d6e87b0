package com.dailyfin.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.dashboard.executor")
public record DashboardExecutorProperties(
        int corePoolSize,
        int maxPoolSize,
        int queueCapacity
) {
    public DashboardExecutorProperties {
        if (corePoolSize <= 0) {
            corePoolSize = 4;
        }
        if (maxPoolSize < corePoolSize) {
            maxPoolSize = Math.max(8, corePoolSize);
        }
        if (queueCapacity <= 0) {
            queueCapacity = 200;
        }
    }
}
