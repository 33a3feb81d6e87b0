package com.dailyfin.backend.mappers;

import com.dailyfin.backend.dto.shopping.ShoppingItemDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListResponseDTO;
import com.dailyfin.backend.entities.ShoppingItem;
import com.dailyfin.backend.entities.ShoppingList;
import com.dailyfin.backend.services.util.ShoppingListRules;

public class ShoppingListMapper {

    private ShoppingListMapper() {

    }

    public static ShoppingListResponseDTO toResponseDTO(ShoppingList l) {
        if (l == null) return null;

        return ShoppingListResponseDTO.builder()
                .id(l.getId())
                .title(l.getTitle())
                .description(l.getDescription())
                .items(l.getItems().stream().map(ShoppingListMapper::toItemDTO).toList())
                .totalBudget(l.getTotalBudget())
                .isCompleted(l.isCompleted())
                .completedAt(l.getCompletedAt())
                .totalItems(l.getItems().size())
                .completedItems(ShoppingListRules.completedItems(l))
                .completionPercentage(ShoppingListRules.completionPercentage(l))
                .totalEstimatedCost(ShoppingListRules.totalEstimatedCost(l))
                .totalActualCost(ShoppingListRules.totalActualCost(l))
                .budgetRemaining(ShoppingListRules.budgetRemaining(l))
                .createdAt(l.getCreatedAt())
                .updatedAt(l.getUpdatedAt())
                .build();
    }

    public static ShoppingItemDTO toItemDTO(ShoppingItem i) {
        return ShoppingItemDTO.builder()
                .id(i.getId())
                .name(i.getName())
                .category(i.getCategory())
                .quantity(i.getQuantity())
                .unit(i.getUnit())
                .estimatedPrice(i.getEstimatedPrice())
                .actualPrice(i.getActualPrice())
                .isPurchased(i.isPurchased())
                .purchasedAt(i.getPurchasedAt())
                .notes(i.getNotes())
                .build();
    }
}
