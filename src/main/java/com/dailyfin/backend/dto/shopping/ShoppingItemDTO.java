package com.dailyfin.backend.dto.shopping;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShoppingItemDTO {

    private UUID id;
    private String name;
    private String category;
    private BigDecimal quantity;
    private String unit;
    private BigDecimal estimatedPrice;
    private BigDecimal actualPrice;
    private Boolean isPurchased;
    private LocalDateTime purchasedAt;
    private String notes;
}
