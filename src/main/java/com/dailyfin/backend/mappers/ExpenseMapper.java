package com.dailyfin.backend.mappers;

import java.util.ArrayList;

import com.dailyfin.backend.dto.expense.ExpenseResponseDTO;
import com.dailyfin.backend.dto.expense.LocationDTO;
import com.dailyfin.backend.dto.expense.RecurringConfigDTO;
import com.dailyfin.backend.entities.Category;
import com.dailyfin.backend.entities.Expense;
import com.dailyfin.backend.entities.ExpenseLocation;
import com.dailyfin.backend.entities.RecurringConfig;

public class ExpenseMapper {

    private ExpenseMapper() {

    }

    public static ExpenseResponseDTO toResponseDTO(Expense e) {
        if (e == null) return null;

        return ExpenseResponseDTO.builder()
                .id(e.getId())
                .category(toCategoryRef(e.getCategory()))
                .amount(e.getAmount())
                .description(e.getDescription())
                .date(e.getDate())
                .paymentMethod(e.getPaymentMethod())
                .tags(new ArrayList<>(e.getTags()))
                .receiptImage(e.getReceiptImage())
                .location(toLocationDTO(e.getLocation()))
                .isRecurring(e.isRecurring())
                .recurringConfig(toRecurringDTO(e.getRecurringConfig()))
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }

    public static ExpenseLocation toLocation(LocationDTO dto) {
        if (dto == null) return null;
        return new ExpenseLocation(dto.getLatitude(), dto.getLongitude(), dto.getAddress());
    }

    public static RecurringConfig toRecurringConfig(RecurringConfigDTO dto) {
        if (dto == null) return null;
        return new RecurringConfig(dto.getInterval(), dto.getEndDate());
    }

    private static ExpenseResponseDTO.CategoryRef toCategoryRef(Category c) {
        if (c == null) return null;
        return ExpenseResponseDTO.CategoryRef.builder()
                .id(c.getId())
                .name(c.getName())
                .icon(c.getIcon())
                .color(c.getColor())
                .build();
    }

    // Hibernate instancia o embeddable vazio quando todas as colunas são nulas
    private static LocationDTO toLocationDTO(ExpenseLocation l) {
        if (l == null || l.getLatitude() == null) return null;
        return new LocationDTO(l.getLatitude(), l.getLongitude(), l.getAddress());
    }

    private static RecurringConfigDTO toRecurringDTO(RecurringConfig r) {
        if (r == null || r.getInterval() == null) return null;
        return new RecurringConfigDTO(r.getInterval(), r.getEndDate());
    }
}
