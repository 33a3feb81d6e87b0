package com.dailyfin.backend.dto.shopping;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ShoppingListRequestDTO {

    @NotBlank(message = "Título é obrigatório")
    @Size(min = 2, max = 100, message = "Título deve ter entre 2 e 100 caracteres")
    private String title;

    @Size(max = 500, message = "Descrição não pode passar de 500 caracteres")
    private String description;

    @DecimalMin(value = "0", message = "Orçamento não pode ser negativo")
    private BigDecimal totalBudget;
}
