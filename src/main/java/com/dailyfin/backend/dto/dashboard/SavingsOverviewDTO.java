package com.dailyfin.backend.dto.dashboard;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsOverviewDTO {

    private BigDecimal totalTarget;
    private BigDecimal totalCurrent;
    private BigDecimal progress;
    private long activeGoals;
}
