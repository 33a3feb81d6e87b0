package com.dailyfin.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShoppingItem {

    @Column(name = "item_id", nullable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(nullable = false, precision = 19, scale = 3)
    private BigDecimal quantity;

    @Column(nullable = false, length = 20)
    private String unit;

    @Column(precision = 19, scale = 2)
    private BigDecimal estimatedPrice;

    @Column(precision = 19, scale = 2)
    private BigDecimal actualPrice;

    @Column(nullable = false)
    private boolean isPurchased;

    private LocalDateTime purchasedAt;

    @Column(length = 200)
    private String notes;
}
