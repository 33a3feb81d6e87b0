package com.dailyfin.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.dailyfin.backend.enums.GoalPriority;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsGoalResponseDTO {

    private UUID id;
    private String title;
    private String description;
    private BigDecimal targetAmount;
    private BigDecimal currentAmount;
    private LocalDate targetDate;
    private String icon;
    private String color;
    private GoalPriority priority;
    private List<ContributionDTO> contributions;
    private Boolean isCompleted;
    private LocalDateTime completedAt;

    // derivados
    private BigDecimal progress;
    private BigDecimal remainingAmount;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
