package com.dailyfin.backend.mappers;

import java.time.LocalDateTime;
import java.util.ArrayList;

import com.dailyfin.backend.dto.task.ReminderDTO;
import com.dailyfin.backend.dto.task.RepeatDTO;
import com.dailyfin.backend.dto.task.SubtaskDTO;
import com.dailyfin.backend.dto.task.TaskResponseDTO;
import com.dailyfin.backend.entities.Subtask;
import com.dailyfin.backend.entities.Task;
import com.dailyfin.backend.entities.TaskReminder;
import com.dailyfin.backend.entities.TaskRepeat;
import com.dailyfin.backend.services.util.TaskRules;

public class TaskMapper {

    private TaskMapper() {

    }

    // "now" define o campo isOverdue
    public static TaskResponseDTO toResponseDTO(Task t, LocalDateTime now) {
        if (t == null) return null;

        return TaskResponseDTO.builder()
                .id(t.getId())
                .title(t.getTitle())
                .description(t.getDescription())
                .priority(t.getPriority())
                .status(t.getStatus())
                .dueDate(t.getDueDate())
                .completedAt(t.getCompletedAt())
                .reminder(toReminderDTO(t.getReminder()))
                .repeat(toRepeatDTO(t.getRepeat()))
                .subtasks(t.getSubtasks().stream().map(TaskMapper::toSubtaskDTO).toList())
                .tags(new ArrayList<>(t.getTags()))
                .isOverdue(TaskRules.isOverdue(t, now))
                .subtaskProgress(TaskRules.subtaskProgress(t))
                .createdAt(t.getCreatedAt())
                .updatedAt(t.getUpdatedAt())
                .build();
    }

    public static SubtaskDTO toSubtaskDTO(Subtask s) {
        return SubtaskDTO.builder()
                .id(s.getId())
                .title(s.getTitle())
                .completed(s.isCompleted())
                .completedAt(s.getCompletedAt())
                .build();
    }

    // sent é controlado pelo agendador, nunca pelo cliente
    public static TaskReminder toReminder(ReminderDTO dto) {
        if (dto == null) return null;
        return new TaskReminder(dto.isEnabled(), dto.getTime(), false);
    }

    public static TaskRepeat toRepeat(RepeatDTO dto) {
        if (dto == null) return null;
        return new TaskRepeat(dto.isEnabled(), dto.getInterval(), dto.getEndDate());
    }

    private static ReminderDTO toReminderDTO(TaskReminder r) {
        if (r == null) return null;
        return ReminderDTO.builder()
                .enabled(r.isEnabled())
                .time(r.getTime())
                .sent(r.isSent())
                .build();
    }

    private static RepeatDTO toRepeatDTO(TaskRepeat r) {
        if (r == null) return null;
        return RepeatDTO.builder()
                .enabled(r.isEnabled())
                .interval(r.getInterval())
                .endDate(r.getEndDate())
                .build();
    }
}
