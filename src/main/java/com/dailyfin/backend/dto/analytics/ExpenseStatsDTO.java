package com.dailyfin.backend.dto.analytics;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseStatsDTO {

    private MonthStatsDTO thisMonth;
    private PeriodTotalsDTO lastMonth;
    private PeriodTotalsDTO allTime;
    private List<CategoryBreakdownDTO> categoryBreakdown;
    private ComparisonDTO comparison;
}
