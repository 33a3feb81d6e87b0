package com.dailyfin.backend.repositories;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.dailyfin.backend.entities.Task;
import com.dailyfin.backend.enums.TaskPriority;
import com.dailyfin.backend.enums.TaskStatus;

/**
 * Filtros da listagem de tarefas, no mesmo formato de {@link ExpenseSpecifications}.
 */
public final class TaskSpecifications {

    private TaskSpecifications() {
    }

    public static Specification<Task> ownedBy(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }

    public static Specification<Task> withStatus(TaskStatus status) {
        if (status == null) return null;
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Task> withStatusIn(Collection<TaskStatus> statuses) {
        return (root, query, cb) -> root.get("status").in(statuses);
    }

    public static Specification<Task> withoutStatus(TaskStatus status) {
        return (root, query, cb) -> cb.notEqual(root.get("status"), status);
    }

    public static Specification<Task> withPriority(TaskPriority priority) {
        if (priority == null) return null;
        return (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }

    public static Specification<Task> dueFrom(LocalDateTime start) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("dueDate"), start);
    }

    public static Specification<Task> dueBefore(LocalDateTime end) {
        return (root, query, cb) -> cb.lessThan(root.get("dueDate"), end);
    }

    public static Specification<Task> taggedWithAny(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        return (root, query, cb) -> {
            var sub = query.subquery(UUID.class);
            var subRoot = sub.from(Task.class);
            var tagJoin = subRoot.join("tags");
            sub.select(subRoot.get("id"))
                    .where(cb.equal(subRoot.get("id"), root.get("id")), tagJoin.in(tags));
            return cb.exists(sub);
        };
    }

    // Título ou descrição, sem diferenciar maiúsculas
    public static Specification<Task> matching(String search) {
        if (search == null || search.isBlank()) return null;
        String pattern = "%" + search.trim().toLowerCase() + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern),
                cb.like(cb.lower(root.get("description")), pattern)
        );
    }
}
