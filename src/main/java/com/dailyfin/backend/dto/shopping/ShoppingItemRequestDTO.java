package com.dailyfin.backend.dto.shopping;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ShoppingItemRequestDTO {

    @NotBlank(message = "Nome do item é obrigatório")
    @Size(max = 100, message = "Nome do item não pode passar de 100 caracteres")
    private String name;

    @Size(max = 50, message = "Categoria não pode passar de 50 caracteres")
    private String category;

    @NotNull(message = "Quantidade é obrigatória")
    @DecimalMin(value = "0.01", message = "Quantidade deve ser maior que zero")
    private BigDecimal quantity;

    @Size(max = 20, message = "Unidade não pode passar de 20 caracteres")
    private String unit;

    @DecimalMin(value = "0", message = "Preço estimado não pode ser negativo")
    private BigDecimal estimatedPrice;

    @Size(max = 200, message = "Observação não pode passar de 200 caracteres")
    private String notes;
}
