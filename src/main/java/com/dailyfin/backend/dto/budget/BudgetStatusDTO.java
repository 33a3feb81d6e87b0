package com.dailyfin.backend.dto.budget;

import java.math.BigDecimal;
import java.util.UUID;

import com.dailyfin.backend.enums.BudgetStatusLevel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetStatusDTO {

    private UUID categoryId;
    private String categoryName;
    private String categoryColor;
    private String categoryIcon;
    private BigDecimal budget;
    private BigDecimal spent;
    private BigDecimal remaining;
    private BigDecimal percentage;
    private BudgetStatusLevel status;

    // cor do status (paleta fixa), não da categoria
    private String color;
}
