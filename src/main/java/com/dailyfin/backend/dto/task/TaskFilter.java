package com.dailyfin.backend.dto.task;

import java.util.List;

import com.dailyfin.backend.enums.TaskPriority;
import com.dailyfin.backend.enums.TaskStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filtros da listagem de tarefas. {@code view} restringe por prazo:
 * today, upcoming (a partir de hoje, não concluídas) ou overdue (antes de hoje, ativas).
 * {@code tags} casa quando a tarefa tem qualquer uma das tags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskFilter {

    private TaskStatus status;
    private TaskPriority priority;
    private List<String> tags;
    private String search;
    private View view;

    public enum View {
        TODAY,
        UPCOMING,
        OVERDUE;

        public static View fromParam(String raw) {
            if (raw == null || raw.isBlank()) return null;
            try {
                return View.valueOf(raw.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Filtro de prazo inválido: " + raw);
            }
        }
    }
}
