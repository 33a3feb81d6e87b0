package com.dailyfin.backend.dto.budget;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * budget = null remove o orçamento da categoria.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateBudgetRequestDTO {

    @DecimalMin(value = "0", message = "Orçamento não pode ser negativo")
    private BigDecimal budget;
}
