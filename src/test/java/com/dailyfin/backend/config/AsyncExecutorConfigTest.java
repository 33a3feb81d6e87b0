package com.dailyfin.backend.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class AsyncExecutorConfigTest {

    @Test
    void notificationTaskExecutor_saturated_dropsTaskWithoutThrowing() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new AsyncExecutorConfig().notificationTaskExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean overflowRan = new AtomicBoolean(false);

        try {
            int capacity = executor.getMaxPoolSize()
                    + executor.getThreadPoolExecutor().getQueue().remainingCapacity();
            for (int i = 0; i < capacity; i++) {
                executor.execute(() -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertDoesNotThrow(() -> executor.execute(() -> overflowRan.set(true)));
        } finally {
            release.countDown();
            executor.shutdown();
        }

        assertFalse(overflowRan.get());
    }
}
