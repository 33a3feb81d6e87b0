package com.dailyfin.backend.entities;

import java.time.LocalDate;

import com.dailyfin.backend.enums.RecurrenceInterval;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuração de recorrência. Apenas armazenada; nenhuma despesa é gerada automaticamente.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecurringConfig {

    @Enumerated(EnumType.STRING)
    @Column(name = "recurring_interval")
    private RecurrenceInterval interval;

    @Column(name = "recurring_end_date")
    private LocalDate endDate;
}
