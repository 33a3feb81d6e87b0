package com.dailyfin.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.dailyfin.backend.enums.GoalPriority;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SavingsGoalRequestDTO {

    @NotBlank(message = "Título é obrigatório")
    @Size(min = 2, max = 100, message = "Título deve ter entre 2 e 100 caracteres")
    private String title;

    @Size(max = 500, message = "Descrição não pode passar de 500 caracteres")
    private String description;

    @NotNull(message = "Valor alvo é obrigatório")
    @DecimalMin(value = "1", message = "Valor alvo deve ser no mínimo 1")
    @DecimalMax(value = "1000000000", message = "Valor alvo muito alto")
    private BigDecimal targetAmount;

    @FutureOrPresent(message = "Data alvo não pode estar no passado")
    private LocalDate targetDate;

    private String icon;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Cor deve estar no formato hexadecimal")
    private String color;

    private GoalPriority priority;
}
