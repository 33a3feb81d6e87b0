package com.dailyfin.backend.dto.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryDeletionCheckDTO {

    private boolean canDelete;
    private long expenseCount;
    private String message;
    private boolean requiresConfirmation;
}
