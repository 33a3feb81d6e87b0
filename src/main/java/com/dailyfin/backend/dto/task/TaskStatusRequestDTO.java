package com.dailyfin.backend.dto.task;

import com.dailyfin.backend.enums.TaskStatus;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusRequestDTO {

    @NotNull(message = "Status é obrigatório")
    private TaskStatus status;
}
