package com.dailyfin.backend.mappers;

import java.util.List;

import com.dailyfin.backend.dto.savings.ContributionDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalResponseDTO;
import com.dailyfin.backend.entities.Contribution;
import com.dailyfin.backend.entities.SavingsGoal;
import com.dailyfin.backend.services.util.SavingsProgressUtils;

public class SavingsGoalMapper {

    private SavingsGoalMapper() {

    }

    public static SavingsGoalResponseDTO toResponseDTO(SavingsGoal g) {
        if (g == null) return null;

        List<ContributionDTO> contributions = g.getContributions().stream()
                .map(SavingsGoalMapper::toContributionDTO)
                .toList();

        return SavingsGoalResponseDTO.builder()
                .id(g.getId())
                .title(g.getTitle())
                .description(g.getDescription())
                .targetAmount(g.getTargetAmount())
                .currentAmount(g.getCurrentAmount())
                .targetDate(g.getTargetDate())
                .icon(g.getIcon())
                .color(g.getColor())
                .priority(g.getPriority())
                .contributions(contributions)
                .isCompleted(g.isCompleted())
                .completedAt(g.getCompletedAt())
                .progress(SavingsProgressUtils.progress(g.getCurrentAmount(), g.getTargetAmount()))
                .remainingAmount(SavingsProgressUtils.remaining(g.getCurrentAmount(), g.getTargetAmount()))
                .createdAt(g.getCreatedAt())
                .updatedAt(g.getUpdatedAt())
                .build();
    }

    public static ContributionDTO toContributionDTO(Contribution c) {
        if (c == null) return null;

        return ContributionDTO.builder()
                .id(c.getId())
                .amount(c.getAmount())
                .type(c.getType())
                .date(c.getDate())
                .note(c.getNote())
                .build();
    }
}
