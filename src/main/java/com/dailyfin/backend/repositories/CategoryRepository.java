package com.dailyfin.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.Category;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    Optional<Category> findByIdAndUserId(UUID id, UUID userId);

    @Query("select c from Category c where c.user.id = :userId order by c.displayOrder asc, c.createdAt asc")
    List<Category> findAllOrdered(@Param("userId") UUID userId);

    List<Category> findByUserIdAndIdIn(UUID userId, Collection<UUID> ids);

    boolean existsByUserIdAndNameIgnoreCase(UUID userId, String name);

    boolean existsByUserIdAndNameIgnoreCaseAndIdNot(UUID userId, String name, UUID id);

    @Query("select coalesce(max(c.displayOrder), 0) from Category c where c.user.id = :userId")
    int findMaxDisplayOrder(@Param("userId") UUID userId);

    // Categorias com orçamento > 0 (Budget Engine / resumo)
    @Query("""
            select c from Category c
            where c.user.id = :userId
            and c.monthlyBudget is not null
            and c.monthlyBudget > 0
            order by c.displayOrder asc
            """)
    List<Category> findWithPositiveBudget(@Param("userId") UUID userId);

    // Categorias com orçamento definido, inclusive zero (dashboard)
    @Query("""
            select c from Category c
            where c.user.id = :userId
            and c.monthlyBudget is not null
            order by c.displayOrder asc
            """)
    List<Category> findWithBudgetDefined(@Param("userId") UUID userId);
}
