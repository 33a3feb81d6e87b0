package com.dailyfin.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.ShoppingList;

public interface ShoppingListRepository extends JpaRepository<ShoppingList, UUID> {

    Optional<ShoppingList> findByIdAndUserId(UUID id, UUID userId);

    List<ShoppingList> findByUserId(UUID userId);

    @Query("""
            select s from ShoppingList s
            where s.user.id = :userId
            and (:completed is null or s.isCompleted = :completed)
            and (:search is null
                or lower(s.title) like lower(concat('%', cast(:search as string), '%')))
            order by s.isCompleted asc, s.createdAt desc
            """)
    List<ShoppingList> search(
            @Param("userId") UUID userId,
            @Param("completed") Boolean completed,
            @Param("search") String search
    );

    @Query("select count(s) from ShoppingList s where s.user.id = :userId and s.isCompleted = false")
    long countActive(@Param("userId") UUID userId);
}
