package com.dailyfin.backend.dto.task;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.dailyfin.backend.enums.TaskPriority;
import com.dailyfin.backend.enums.TaskStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponseDTO {

    private UUID id;
    private String title;
    private String description;
    private TaskPriority priority;
    private TaskStatus status;
    private LocalDateTime dueDate;
    private LocalDateTime completedAt;
    private ReminderDTO reminder;
    private RepeatDTO repeat;
    private List<SubtaskDTO> subtasks;
    private List<String> tags;

    private Boolean isOverdue;
    private int subtaskProgress;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
