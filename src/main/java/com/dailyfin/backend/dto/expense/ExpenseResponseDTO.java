package com.dailyfin.backend.dto.expense;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.dailyfin.backend.enums.PaymentMethod;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseResponseDTO {

    private UUID id;
    private CategoryRef category;
    private BigDecimal amount;
    private String description;
    private LocalDateTime date;
    private PaymentMethod paymentMethod;
    private List<String> tags;
    private String receiptImage;
    private LocationDTO location;
    private Boolean isRecurring;
    private RecurringConfigDTO recurringConfig;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryRef {
        private UUID id;
        private String name;
        private String icon;
        private String color;
    }
}
