package com.dailyfin.backend.dto.dashboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOverviewDTO {

    private long dueToday;
    private long overdue;
    private long completedThisWeek;
    private long active;
}
