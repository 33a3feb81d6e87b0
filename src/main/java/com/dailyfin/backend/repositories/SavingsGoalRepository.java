package com.dailyfin.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.SavingsGoal;
import com.dailyfin.backend.enums.ContributionType;

public interface SavingsGoalRepository extends JpaRepository<SavingsGoal, UUID> {

    interface ActiveSavingsProjection {
        BigDecimal getTotalTarget();
        BigDecimal getTotalCurrent();
        Long getActiveGoals();
    }

    interface ContributionActivityProjection {
        UUID getGoalId();
        String getGoalTitle();
        UUID getContributionId();
        BigDecimal getAmount();
        ContributionType getType();
        LocalDateTime getDate();
        String getNote();
    }

    Optional<SavingsGoal> findByIdAndUserId(UUID id, UUID userId);

    List<SavingsGoal> findByUserId(UUID userId);

    @Query("select g from SavingsGoal g where g.user.id = :userId and g.isCompleted = false")
    List<SavingsGoal> findActive(@Param("userId") UUID userId);

    @Query("""
            select coalesce(sum(g.targetAmount), 0) as totalTarget,
                   coalesce(sum(g.currentAmount), 0) as totalCurrent,
                   count(g) as activeGoals
            from SavingsGoal g
            where g.user.id = :userId and g.isCompleted = false
            """)
    ActiveSavingsProjection summarizeActive(@Param("userId") UUID userId);

    // Contribuições de todas as metas, achatadas e ordenadas globalmente
    @Query("""
            select g.id as goalId, g.title as goalTitle, c.id as contributionId,
                   c.amount as amount, c.type as type, c.date as date, c.note as note
            from SavingsGoal g join g.contributions c
            where g.user.id = :userId
            order by c.date desc
            """)
    List<ContributionActivityProjection> findRecentContributions(@Param("userId") UUID userId, Pageable pageable);
}
