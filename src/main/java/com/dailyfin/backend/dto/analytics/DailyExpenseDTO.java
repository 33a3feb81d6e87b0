package com.dailyfin.backend.dto.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyExpenseDTO {

    private LocalDate date;
    private BigDecimal total;
    private long count;
}
