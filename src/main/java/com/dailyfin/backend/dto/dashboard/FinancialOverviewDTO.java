package com.dailyfin.backend.dto.dashboard;

import java.math.BigDecimal;
import java.util.List;

import com.dailyfin.backend.enums.BudgetStatusLevel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialOverviewDTO {

    private BigDecimal totalExpensesThisMonth;
    private long expenseCountThisMonth;
    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
    private BigDecimal budgetRemaining;
    private BigDecimal budgetPercentage;
    private BudgetStatusLevel budgetStatus;
    private SavingsOverviewDTO savings;
    private List<TopCategoryDTO> topCategories;
}
