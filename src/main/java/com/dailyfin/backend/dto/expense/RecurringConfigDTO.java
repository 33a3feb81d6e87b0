package com.dailyfin.backend.dto.expense;

import java.time.LocalDate;

import com.dailyfin.backend.enums.RecurrenceInterval;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecurringConfigDTO {

    @NotNull(message = "Intervalo de recorrência é obrigatório")
    private RecurrenceInterval interval;

    private LocalDate endDate;
}
