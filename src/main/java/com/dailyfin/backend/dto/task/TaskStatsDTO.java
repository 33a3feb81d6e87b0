package com.dailyfin.backend.dto.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatsDTO {

    private long total;
    private long todo;
    private long inProgress;
    private long completed;
    private long cancelled;
    private long overdue;
    private long dueToday;
}
