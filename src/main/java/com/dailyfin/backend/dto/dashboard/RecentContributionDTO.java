package com.dailyfin.backend.dto.dashboard;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.dailyfin.backend.enums.ContributionType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentContributionDTO {

    private UUID goalId;
    private String goalTitle;
    private UUID contributionId;
    private BigDecimal amount;
    private ContributionType type;
    private LocalDateTime date;
    private String note;
}
