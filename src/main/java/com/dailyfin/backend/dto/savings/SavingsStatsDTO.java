package com.dailyfin.backend.dto.savings;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsStatsDTO {

    private int totalGoals;
    private int completedGoals;
    private int activeGoals;
    private BigDecimal totalTargetAmount;
    private BigDecimal totalCurrentAmount;
    private BigDecimal totalRemainingAmount;
    private BigDecimal overallProgress;
}
