package com.dailyfin.backend.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Relógio usado por todas as regras dependentes de data (janelas mensais, prazos, lembretes).
 * Testes substituem por {@link Clock#fixed}.
 */
@Configuration
public class ClockConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
