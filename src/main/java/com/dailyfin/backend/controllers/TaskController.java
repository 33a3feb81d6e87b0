package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.task.SubtaskRequestDTO;
import com.dailyfin.backend.dto.task.SubtaskUpdateDTO;
import com.dailyfin.backend.dto.task.TaskFilter;
import com.dailyfin.backend.dto.task.TaskRequestDTO;
import com.dailyfin.backend.dto.task.TaskResponseDTO;
import com.dailyfin.backend.dto.task.TaskStatsDTO;
import com.dailyfin.backend.dto.task.TaskStatusRequestDTO;
import com.dailyfin.backend.dto.task.TaskUpdateDTO;
import com.dailyfin.backend.enums.TaskPriority;
import com.dailyfin.backend.enums.TaskStatus;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.TaskService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<TaskResponseDTO>> create(@Valid @RequestBody TaskRequestDTO dto) {
        TaskResponseDTO created = taskService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Tarefa criada com sucesso"));
    }

    // dueDate aceita today, upcoming ou overdue
    @GetMapping
    public ResponseEntity<ApiResponse<List<TaskResponseDTO>>> findAll(
            @RequestParam(required = false) TaskStatus status,
            @RequestParam(required = false) TaskPriority priority,
            @RequestParam(required = false) String tags,
            @RequestParam(required = false) String dueDate,
            @RequestParam(required = false) String search
    ) {
        TaskFilter filter = TaskFilter.builder()
                .status(status)
                .priority(priority)
                .tags(QueryParams.splitCsv(tags))
                .view(TaskFilter.View.fromParam(dueDate))
                .search(search)
                .build();

        List<TaskResponseDTO> tasks = taskService.findAll(securityService.getCurrentUserId(), filter);
        return ResponseEntity.ok(ApiResponse.success(tasks, "Tarefas carregadas com sucesso"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<TaskStatsDTO>> stats() {
        TaskStatsDTO stats = taskService.stats(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas de tarefas carregadas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> findById(@PathVariable UUID id) {
        TaskResponseDTO task = taskService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(task, "Tarefa encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody TaskUpdateDTO dto
    ) {
        TaskResponseDTO updated = taskService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Tarefa atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        taskService.delete(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.message("Tarefa removida com sucesso"));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> updateStatus(
            @PathVariable UUID id,
            @Valid @RequestBody TaskStatusRequestDTO dto
    ) {
        TaskResponseDTO updated = taskService.updateStatus(securityService.getCurrentUserId(), id, dto.getStatus());
        return ResponseEntity.ok(ApiResponse.success(updated, "Status atualizado"));
    }

    @PostMapping("/{id}/subtasks")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> addSubtask(
            @PathVariable UUID id,
            @Valid @RequestBody SubtaskRequestDTO dto
    ) {
        TaskResponseDTO task = taskService.addSubtask(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(task, "Subtarefa adicionada"));
    }

    @PutMapping("/{id}/subtasks/{subtaskId}")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> updateSubtask(
            @PathVariable UUID id,
            @PathVariable UUID subtaskId,
            @Valid @RequestBody SubtaskUpdateDTO dto
    ) {
        TaskResponseDTO task = taskService.updateSubtask(securityService.getCurrentUserId(), id, subtaskId, dto);
        return ResponseEntity.ok(ApiResponse.success(task, "Subtarefa atualizada"));
    }

    @DeleteMapping("/{id}/subtasks/{subtaskId}")
    public ResponseEntity<ApiResponse<TaskResponseDTO>> deleteSubtask(
            @PathVariable UUID id,
            @PathVariable UUID subtaskId
    ) {
        TaskResponseDTO task = taskService.deleteSubtask(securityService.getCurrentUserId(), id, subtaskId);
        return ResponseEntity.ok(ApiResponse.success(task, "Subtarefa removida"));
    }
}
