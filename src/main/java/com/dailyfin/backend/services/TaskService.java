package com.dailyfin.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.task.SubtaskRequestDTO;
import com.dailyfin.backend.dto.task.SubtaskUpdateDTO;
import com.dailyfin.backend.dto.task.TaskFilter;
import com.dailyfin.backend.dto.task.TaskRequestDTO;
import com.dailyfin.backend.dto.task.TaskResponseDTO;
import com.dailyfin.backend.dto.task.TaskStatsDTO;
import com.dailyfin.backend.dto.task.TaskUpdateDTO;
import com.dailyfin.backend.entities.Subtask;
import com.dailyfin.backend.entities.Task;
import com.dailyfin.backend.enums.TaskStatus;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.TaskMapper;
import com.dailyfin.backend.notifications.NotificationDispatch;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.repositories.TaskRepository;
import com.dailyfin.backend.repositories.TaskSpecifications;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.services.util.DateWindows;
import com.dailyfin.backend.services.util.DateWindows.Window;
import com.dailyfin.backend.services.util.TaskRules;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;
    private final UserRepository userRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public TaskResponseDTO create(UUID userId, TaskRequestDTO dto) {
        LocalDateTime now = LocalDateTime.now(clock);

        Task task = Task.builder()
                .user(userRepository.getReferenceById(userId))
                .title(dto.getTitle().trim())
                .description(dto.getDescription())
                .dueDate(dto.getDueDate())
                .reminder(TaskMapper.toReminder(dto.getReminder()))
                .repeat(TaskMapper.toRepeat(dto.getRepeat()))
                .build();

        if (dto.getPriority() != null) task.setPriority(dto.getPriority());
        if (dto.getTags() != null) task.setTags(new LinkedHashSet<>(dto.getTags()));
        TaskRules.applyStatus(task, dto.getStatus() != null ? dto.getStatus() : TaskStatus.TODO, now);

        return TaskMapper.toResponseDTO(taskRepository.save(task), now);
    }

    /**
     * Lista com filtros combinados (AND). O filtro de prazo "upcoming" e "overdue"
     * substitui o filtro de status.
     */
    @Transactional(readOnly = true)
    public List<TaskResponseDTO> findAll(UUID userId, TaskFilter filter) {
        LocalDateTime now = LocalDateTime.now(clock);

        Specification<Task> spec = Specification.where(TaskSpecifications.ownedBy(userId))
                .and(TaskSpecifications.withPriority(filter.getPriority()))
                .and(TaskSpecifications.taggedWithAny(filter.getTags()))
                .and(TaskSpecifications.matching(filter.getSearch()));

        LocalDateTime today = DateWindows.startOfToday(clock);
        TaskFilter.View view = filter.getView();
        if (view == null || view == TaskFilter.View.TODAY) {
            spec = spec.and(TaskSpecifications.withStatus(filter.getStatus()));
        }
        if (view == TaskFilter.View.TODAY) {
            spec = spec.and(TaskSpecifications.dueFrom(today))
                    .and(TaskSpecifications.dueBefore(today.plusDays(1)));
        } else if (view == TaskFilter.View.UPCOMING) {
            spec = spec.and(TaskSpecifications.dueFrom(today))
                    .and(TaskSpecifications.withoutStatus(TaskStatus.COMPLETED));
        } else if (view == TaskFilter.View.OVERDUE) {
            spec = spec.and(TaskSpecifications.dueBefore(today))
                    .and(TaskSpecifications.withStatusIn(TaskStatus.ACTIVE));
        }

        return taskRepository.findAll(spec).stream()
                .sorted(TaskRules.LISTING_ORDER)
                .map(t -> TaskMapper.toResponseDTO(t, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public TaskResponseDTO findById(UUID userId, UUID taskId) {
        return TaskMapper.toResponseDTO(findEntity(userId, taskId), LocalDateTime.now(clock));
    }

    @Transactional
    public TaskResponseDTO update(UUID userId, UUID taskId, TaskUpdateDTO dto) {
        Task task = findEntity(userId, taskId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (dto.getTitle() != null) task.setTitle(dto.getTitle().trim());
        if (dto.getDescription() != null) task.setDescription(dto.getDescription());
        if (dto.getPriority() != null) task.setPriority(dto.getPriority());
        if (dto.getDueDate() != null) task.setDueDate(dto.getDueDate());
        if (dto.getReminder() != null) task.setReminder(TaskMapper.toReminder(dto.getReminder()));
        if (dto.getRepeat() != null) task.setRepeat(TaskMapper.toRepeat(dto.getRepeat()));
        if (dto.getTags() != null) task.setTags(new LinkedHashSet<>(dto.getTags()));
        if (dto.getStatus() != null) TaskRules.applyStatus(task, dto.getStatus(), now);

        return TaskMapper.toResponseDTO(taskRepository.save(task), now);
    }

    @Transactional
    public void delete(UUID userId, UUID taskId) {
        taskRepository.delete(findEntity(userId, taskId));
    }

    @Transactional
    public TaskResponseDTO updateStatus(UUID userId, UUID taskId, TaskStatus status) {
        Task task = findEntity(userId, taskId);
        LocalDateTime now = LocalDateTime.now(clock);
        TaskRules.applyStatus(task, status, now);
        return TaskMapper.toResponseDTO(taskRepository.save(task), now);
    }

    @Transactional
    public TaskResponseDTO addSubtask(UUID userId, UUID taskId, SubtaskRequestDTO dto) {
        Task task = findEntity(userId, taskId);

        task.getSubtasks().add(Subtask.builder()
                .id(UUID.randomUUID())
                .title(dto.getTitle().trim())
                .completed(false)
                .build());

        return TaskMapper.toResponseDTO(taskRepository.save(task), LocalDateTime.now(clock));
    }

    @Transactional
    public TaskResponseDTO updateSubtask(UUID userId, UUID taskId, UUID subtaskId, SubtaskUpdateDTO dto) {
        Task task = findEntity(userId, taskId);
        LocalDateTime now = LocalDateTime.now(clock);

        Subtask subtask = task.getSubtasks().stream()
                .filter(s -> s.getId().equals(subtaskId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Subtarefa não encontrada"));

        if (dto.getTitle() != null) subtask.setTitle(dto.getTitle().trim());
        if (dto.getCompleted() != null) TaskRules.applySubtaskCompletion(subtask, dto.getCompleted(), now);

        return TaskMapper.toResponseDTO(taskRepository.save(task), now);
    }

    @Transactional
    public TaskResponseDTO deleteSubtask(UUID userId, UUID taskId, UUID subtaskId) {
        Task task = findEntity(userId, taskId);

        boolean removed = task.getSubtasks().removeIf(s -> s.getId().equals(subtaskId));
        if (!removed) {
            throw new ResourceNotFoundException("Subtarefa não encontrada");
        }

        return TaskMapper.toResponseDTO(taskRepository.save(task), LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public TaskStatsDTO stats(UUID userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Window today = DateWindows.today(clock);

        return TaskStatsDTO.builder()
                .total(taskRepository.countByUserId(userId))
                .todo(taskRepository.countByUserIdAndStatus(userId, TaskStatus.TODO))
                .inProgress(taskRepository.countByUserIdAndStatus(userId, TaskStatus.IN_PROGRESS))
                .completed(taskRepository.countByUserIdAndStatus(userId, TaskStatus.COMPLETED))
                .cancelled(taskRepository.countByUserIdAndStatus(userId, TaskStatus.CANCELLED))
                .overdue(taskRepository.countDueBefore(userId, TaskStatus.ACTIVE, now))
                .dueToday(taskRepository.countDueBetween(
                        userId, EnumSet.allOf(TaskStatus.class), today.start(), today.end()))
                .build();
    }

    /**
     * Envia um lembrete para cada tarefa ativa com lembrete vencido e ainda não enviado,
     * marcando-o como enviado. Retorna quantos foram disparados.
     */
    @Transactional
    public int processDueReminders() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Task> due = taskRepository.findDueReminders(now, TaskStatus.ACTIVE);

        int sent = 0;
        for (Task task : due) {
            // Lembrete recusado continua pendente para a próxima execução
            boolean accepted = NotificationDispatch.dispatch("lembrete de tarefa",
                    () -> notificationService.sendTaskReminder(task.getUser().getId(), task.getTitle(), task.getDueDate()));
            if (accepted) {
                task.getReminder().setSent(true);
                sent++;
            }
        }
        taskRepository.saveAll(due);

        return sent;
    }

    private Task findEntity(UUID userId, UUID taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Tarefa não encontrada"));
    }
}
