package com.dailyfin.backend.dto.expense;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.dailyfin.backend.enums.PaymentMethod;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Atualização parcial de despesa.
 */
@Data
public class ExpenseUpdateDTO {

    private UUID categoryId;

    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    @DecimalMax(value = "10000000", message = "Valor muito alto")
    private BigDecimal amount;

    @Size(max = 200, message = "Descrição não pode passar de 200 caracteres")
    private String description;

    private LocalDateTime date;

    private PaymentMethod paymentMethod;

    @Size(max = 10, message = "Máximo de 10 tags")
    private List<@Size(max = 20, message = "Tag muito longa") String> tags;

    private String receiptImage;

    @Valid
    private LocationDTO location;

    private Boolean isRecurring;

    @Valid
    private RecurringConfigDTO recurringConfig;
}
