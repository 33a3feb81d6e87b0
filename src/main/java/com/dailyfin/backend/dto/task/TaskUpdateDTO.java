package com.dailyfin.backend.dto.task;

import java.time.LocalDateTime;
import java.util.List;

import com.dailyfin.backend.enums.TaskPriority;
import com.dailyfin.backend.enums.TaskStatus;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Atualização parcial: apenas campos não nulos são aplicados.
 */
@Data
public class TaskUpdateDTO {

    @Size(min = 2, max = 200, message = "Título deve ter entre 2 e 200 caracteres")
    private String title;

    @Size(max = 1000, message = "Descrição não pode passar de 1000 caracteres")
    private String description;

    private TaskPriority priority;

    private TaskStatus status;

    private LocalDateTime dueDate;

    private ReminderDTO reminder;

    private RepeatDTO repeat;

    @Size(max = 10, message = "Máximo de 10 tags")
    private List<@Size(max = 30, message = "Tag não pode passar de 30 caracteres") String> tags;
}
