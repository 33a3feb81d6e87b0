package com.dailyfin.backend.dto.category;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CategoryRequestDTO {

    @NotBlank(message = "Nome da categoria é obrigatório")
    @Size(min = 2, max = 30, message = "Nome da categoria deve ter entre 2 e 30 caracteres")
    private String name;

    @Size(max = 50, message = "Ícone muito longo")
    private String icon;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Cor deve estar no formato hexadecimal (ex: #FF6B6B)")
    private String color;

    @DecimalMin(value = "0", message = "Orçamento não pode ser negativo")
    private BigDecimal monthlyBudget;
}
