package com.dailyfin.backend.repositories;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.Task;
import com.dailyfin.backend.enums.TaskStatus;

public interface TaskRepository extends JpaRepository<Task, UUID>, JpaSpecificationExecutor<Task> {

    Optional<Task> findByIdAndUserId(UUID id, UUID userId);

    long countByUserId(UUID userId);

    long countByUserIdAndStatus(UUID userId, TaskStatus status);

    long countByUserIdAndStatusIn(UUID userId, Collection<TaskStatus> statuses);

    @Query("""
            select count(t) from Task t
            where t.user.id = :userId
            and t.status in :statuses
            and t.dueDate between :start and :end
            """)
    long countDueBetween(
            @Param("userId") UUID userId,
            @Param("statuses") Collection<TaskStatus> statuses,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
            select count(t) from Task t
            where t.user.id = :userId
            and t.status in :statuses
            and t.dueDate < :before
            """)
    long countDueBefore(
            @Param("userId") UUID userId,
            @Param("statuses") Collection<TaskStatus> statuses,
            @Param("before") LocalDateTime before
    );

    @Query("""
            select count(t) from Task t
            where t.user.id = :userId
            and t.status = com.dailyfin.backend.enums.TaskStatus.COMPLETED
            and t.completedAt >= :since
            """)
    long countCompletedSince(@Param("userId") UUID userId, @Param("since") LocalDateTime since);

    // Tarefas sem prazo ficam por último
    @Query("""
            select t from Task t
            where t.user.id = :userId
            and t.status in :statuses
            order by t.dueDate asc nulls last, t.createdAt desc
            """)
    List<Task> findByStatusOrderByNearestDue(
            @Param("userId") UUID userId,
            @Param("statuses") Collection<TaskStatus> statuses,
            Pageable pageable
    );

    @Query("""
            select t from Task t join fetch t.user
            where t.reminder.enabled = true
            and t.reminder.sent = false
            and t.reminder.time <= :now
            and t.status in :statuses
            """)
    List<Task> findDueReminders(
            @Param("now") LocalDateTime now,
            @Param("statuses") Collection<TaskStatus> statuses
    );
}
