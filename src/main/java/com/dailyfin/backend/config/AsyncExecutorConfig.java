package com.dailyfin.backend.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncExecutorConfig.class);

    // Blocos independentes do dashboard
    @Bean(name = "dashboardTaskExecutor")
    public Executor dashboardTaskExecutor(DashboardExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.corePoolSize());
        executor.setMaxPoolSize(properties.maxPoolSize());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("dashboard-");
        executor.initialize();
        return executor;
    }

    // Notificações (push + websocket), sempre fora da thread da requisição
    @Bean(name = "notificationTaskExecutor")
    public Executor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("notification-");
        executor.setRejectedExecutionHandler(new DiscardWithLogging());
        executor.initialize();
        return executor;
    }

    // Fila cheia: a notificação é descartada, quem chamou segue normalmente
    static class DiscardWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            logger.warn("[Notification] Fila de notificações cheia ({} pendentes), descartando envio",
                    executor.getQueue().size());
        }
    }
}
