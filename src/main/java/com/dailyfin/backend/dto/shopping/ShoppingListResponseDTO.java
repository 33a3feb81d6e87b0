package com.dailyfin.backend.dto.shopping;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShoppingListResponseDTO {

    private UUID id;
    private String title;
    private String description;
    private List<ShoppingItemDTO> items;
    private BigDecimal totalBudget;
    private Boolean isCompleted;
    private LocalDateTime completedAt;

    private int totalItems;
    private int completedItems;
    private int completionPercentage;
    private BigDecimal totalEstimatedCost;
    private BigDecimal totalActualCost;
    private BigDecimal budgetRemaining;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
