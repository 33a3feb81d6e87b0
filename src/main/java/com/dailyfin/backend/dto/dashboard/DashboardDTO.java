package com.dailyfin.backend.dto.dashboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot consolidado da tela inicial.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardDTO {

    private FinancialOverviewDTO financial;
    private TaskOverviewDTO tasks;
    private RecentActivityDTO recentActivity;
    private QuickStatsDTO quickStats;
    private ChartsDTO charts;
}
