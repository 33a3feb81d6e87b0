package com.dailyfin.backend.dto.analytics;

import java.math.BigDecimal;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryBreakdownDTO {

    private UUID categoryId;
    private String categoryName;
    private String categoryIcon;
    private String categoryColor;
    private BigDecimal categoryBudget;
    private BigDecimal total;
    private long count;
    private BigDecimal percentage;

    // null quando a categoria não tem orçamento
    private CategoryBudgetSnapshotDTO budgetStatus;
}
