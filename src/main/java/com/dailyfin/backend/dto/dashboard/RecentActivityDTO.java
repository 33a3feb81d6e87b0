package com.dailyfin.backend.dto.dashboard;

import java.util.List;

import com.dailyfin.backend.dto.expense.ExpenseResponseDTO;
import com.dailyfin.backend.dto.task.TaskResponseDTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentActivityDTO {

    private List<ExpenseResponseDTO> expenses;
    private List<RecentContributionDTO> savings;
    private List<TaskResponseDTO> tasks;
}
