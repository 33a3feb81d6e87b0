package com.dailyfin.backend.dto.budget;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSummaryDTO {

    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
    private BigDecimal totalRemaining;
    private BigDecimal overallPercentage;
    private int categoriesWithBudget;
    private int categoriesOverBudget;
    private List<BudgetStatusDTO> categories;

    public static BudgetSummaryDTO empty() {
        return BudgetSummaryDTO.builder()
                .totalBudget(BigDecimal.ZERO)
                .totalSpent(BigDecimal.ZERO)
                .totalRemaining(BigDecimal.ZERO)
                .overallPercentage(BigDecimal.ZERO)
                .categoriesWithBudget(0)
                .categoriesOverBudget(0)
                .categories(new ArrayList<>())
                .build();
    }
}
