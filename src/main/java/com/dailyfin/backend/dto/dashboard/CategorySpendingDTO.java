package com.dailyfin.backend.dto.dashboard;

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
public class CategorySpendingDTO {

    private UUID categoryId;
    private String categoryName;
    private String categoryColor;
    private BigDecimal amount;
    private BigDecimal percentage;
}
