package com.dailyfin.backend.dto.shopping;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShoppingStatsDTO {

    private int totalLists;
    private int activeLists;
    private int completedLists;
    private int totalItems;
    private int purchasedItems;
    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
}
