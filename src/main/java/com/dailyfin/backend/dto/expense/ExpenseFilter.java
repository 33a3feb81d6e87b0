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

/**
 * Filtros da listagem de despesas. Todos opcionais e combinados com AND;
 * {@code tags} casa quando a despesa tem qualquer uma das tags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseFilter {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private UUID categoryId;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private BigDecimal minAmount;
    private BigDecimal maxAmount;
    private PaymentMethod paymentMethod;
    private List<String> tags;

    @Builder.Default
    private int page = DEFAULT_PAGE;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    @Builder.Default
    private SortField sortBy = SortField.DATE;

    @Builder.Default
    private boolean ascending = false;

    public enum SortField {
        DATE("date"),
        AMOUNT("amount"),
        CREATED_AT("createdAt");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }

        public static SortField fromParam(String raw) {
            if (raw == null || raw.isBlank()) return DATE;
            for (SortField f : values()) {
                if (f.property.equalsIgnoreCase(raw)) return f;
            }
            throw new IllegalArgumentException("sortBy inválido: " + raw);
        }
    }
}
