package com.dailyfin.backend.services.util;

import java.time.LocalDateTime;
import java.util.Comparator;

import com.dailyfin.backend.entities.Subtask;
import com.dailyfin.backend.entities.Task;
import com.dailyfin.backend.enums.TaskStatus;

/**
 * Invariantes e valores derivados de tarefas. Os métodos apply* devem ser chamados
 * em toda mutação de status ou de subtarefas.
 */
public final class TaskRules {

    /** Prioridade (urgente primeiro), prazo mais próximo, mais recente. */
    public static final Comparator<Task> LISTING_ORDER = Comparator
            .comparingInt((Task t) -> t.getPriority().rank())
            .thenComparing(Task::getDueDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Task::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private TaskRules() {
    }

    /** completedAt definido sse status == COMPLETED. */
    public static void applyStatus(Task task, TaskStatus status, LocalDateTime now) {
        task.setStatus(status);
        if (status == TaskStatus.COMPLETED) {
            if (task.getCompletedAt() == null) {
                task.setCompletedAt(now);
            }
        } else {
            task.setCompletedAt(null);
        }
    }

    /** completedAt da subtarefa definido sse completed. */
    public static void applySubtaskCompletion(Subtask subtask, boolean completed, LocalDateTime now) {
        subtask.setCompleted(completed);
        if (completed) {
            if (subtask.getCompletedAt() == null) {
                subtask.setCompletedAt(now);
            }
        } else {
            subtask.setCompletedAt(null);
        }
    }

    public static boolean isOverdue(Task task, LocalDateTime now) {
        if (task.getDueDate() == null) return false;
        if (!task.getStatus().isActive()) return false;
        return now.isAfter(task.getDueDate());
    }

    /** Percentual inteiro de subtarefas concluídas (0 quando não há subtarefas). */
    public static int subtaskProgress(Task task) {
        int total = task.getSubtasks().size();
        if (total == 0) return 0;
        long done = task.getSubtasks().stream().filter(Subtask::isCompleted).count();
        return (int) Math.round(done * 100.0 / total);
    }
}
