package com.dailyfin.backend.services.util;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dailyfin.backend.entities.ShoppingItem;
import com.dailyfin.backend.entities.ShoppingList;

/**
 * Invariantes e totais derivados de listas de compras.
 */
public final class ShoppingListRules {

    private ShoppingListRules() {
    }

    /** purchasedAt definido sse o item foi comprado. */
    public static void applyPurchase(ShoppingItem item, boolean purchased, LocalDateTime now) {
        item.setPurchased(purchased);
        if (purchased) {
            if (item.getPurchasedAt() == null) {
                item.setPurchasedAt(now);
            }
        } else {
            item.setPurchasedAt(null);
        }
    }

    /**
     * Lista com ao menos um item fica concluída sse todos os itens foram comprados.
     * Lista vazia mantém o estado atual.
     */
    public static void recomputeCompletion(ShoppingList list, LocalDateTime now) {
        if (list.getItems().isEmpty()) return;

        boolean allPurchased = list.getItems().stream().allMatch(ShoppingItem::isPurchased);
        if (allPurchased && !list.isCompleted()) {
            list.setCompleted(true);
            list.setCompletedAt(now);
        } else if (!allPurchased && list.isCompleted()) {
            list.setCompleted(false);
            list.setCompletedAt(null);
        }
    }

    public static int completedItems(ShoppingList list) {
        return (int) list.getItems().stream().filter(ShoppingItem::isPurchased).count();
    }

    public static int completionPercentage(ShoppingList list) {
        int total = list.getItems().size();
        if (total == 0) return 0;
        return (int) Math.round(completedItems(list) * 100.0 / total);
    }

    public static BigDecimal totalEstimatedCost(ShoppingList list) {
        return list.getItems().stream()
                .map(i -> priceOrZero(i.getEstimatedPrice()).multiply(i.getQuantity()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Apenas itens comprados. */
    public static BigDecimal totalActualCost(ShoppingList list) {
        return list.getItems().stream()
                .filter(ShoppingItem::isPurchased)
                .map(i -> priceOrZero(i.getActualPrice()).multiply(i.getQuantity()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal budgetRemaining(ShoppingList list) {
        if (list.getTotalBudget() == null || list.getTotalBudget().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return list.getTotalBudget().subtract(totalActualCost(list));
    }

    private static BigDecimal priceOrZero(BigDecimal price) {
        return price != null ? price : BigDecimal.ZERO;
    }
}
