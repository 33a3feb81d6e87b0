package com.dailyfin.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.lang.Nullable;

import com.dailyfin.backend.entities.Expense;

public interface ExpenseRepository extends JpaRepository<Expense, UUID>, JpaSpecificationExecutor<Expense> {

    interface TotalCountProjection {
        BigDecimal getTotal();
        Long getCount();
    }

    interface CategoryTotalProjection {
        UUID getCategoryId();
        BigDecimal getTotal();
        Long getCount();
    }

    interface CategorySpendingProjection {
        UUID getCategoryId();
        String getCategoryName();
        String getCategoryIcon();
        String getCategoryColor();
        BigDecimal getCategoryBudget();
        BigDecimal getTotal();
        Long getCount();
    }

    interface DatedAmountProjection {
        LocalDateTime getDate();
        BigDecimal getAmount();
    }

    @EntityGraph(attributePaths = "category")
    Optional<Expense> findByIdAndUserId(UUID id, UUID userId);

    @Override
    @EntityGraph(attributePaths = "category")
    Page<Expense> findAll(@Nullable Specification<Expense> spec, Pageable pageable);

    @EntityGraph(attributePaths = "category")
    List<Expense> findByUserIdOrderByDateDesc(UUID userId, Pageable pageable);

    long countByUserIdAndCategoryId(UUID userId, UUID categoryId);

    long deleteByUserIdAndCategoryId(UUID userId, UUID categoryId);

    @Query("""
            select coalesce(sum(e.amount), 0) from Expense e
            where e.user.id = :userId
            and e.category.id = :categoryId
            and e.date between :start and :end
            """)
    BigDecimal sumForCategoryBetween(
            @Param("userId") UUID userId,
            @Param("categoryId") UUID categoryId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    // Uma única query agrupada para todas as categorias candidatas
    @Query("""
            select e.category.id as categoryId, coalesce(sum(e.amount), 0) as total, count(e) as count
            from Expense e
            where e.user.id = :userId
            and e.category.id in :categoryIds
            and e.date between :start and :end
            group by e.category.id
            """)
    List<CategoryTotalProjection> sumByCategoriesBetween(
            @Param("userId") UUID userId,
            @Param("categoryIds") Collection<UUID> categoryIds,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
            select coalesce(sum(e.amount), 0) as total, count(e) as count
            from Expense e
            where e.user.id = :userId and e.date >= :start
            """)
    TotalCountProjection totalsSince(@Param("userId") UUID userId, @Param("start") LocalDateTime start);

    @Query("""
            select coalesce(sum(e.amount), 0) as total, count(e) as count
            from Expense e
            where e.user.id = :userId and e.date between :start and :end
            """)
    TotalCountProjection totalsBetween(
            @Param("userId") UUID userId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
            select coalesce(sum(e.amount), 0) as total, count(e) as count
            from Expense e
            where e.user.id = :userId
            """)
    TotalCountProjection totalsAllTime(@Param("userId") UUID userId);

    @Query("""
            select c.id as categoryId, c.name as categoryName, c.icon as categoryIcon,
                   c.color as categoryColor, c.monthlyBudget as categoryBudget,
                   sum(e.amount) as total, count(e) as count
            from Expense e join e.category c
            where e.user.id = :userId and e.date >= :start
            group by c.id, c.name, c.icon, c.color, c.monthlyBudget
            order by sum(e.amount) desc
            """)
    List<CategorySpendingProjection> categorySpendingSince(
            @Param("userId") UUID userId,
            @Param("start") LocalDateTime start
    );

    @Query("""
            select c.id as categoryId, c.name as categoryName, c.icon as categoryIcon,
                   c.color as categoryColor, c.monthlyBudget as categoryBudget,
                   sum(e.amount) as total, count(e) as count
            from Expense e join e.category c
            where e.user.id = :userId and e.date between :start and :end
            group by c.id, c.name, c.icon, c.color, c.monthlyBudget
            order by sum(e.amount) desc
            """)
    List<CategorySpendingProjection> categorySpendingBetween(
            @Param("userId") UUID userId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            Pageable pageable
    );

    @Query("""
            select e.date as date, e.amount as amount
            from Expense e
            where e.user.id = :userId and e.date >= :start
            order by e.date asc
            """)
    List<DatedAmountProjection> findDatedAmountsSince(
            @Param("userId") UUID userId,
            @Param("start") LocalDateTime start
    );
}
