package com.dailyfin.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.Note;

public interface NoteRepository extends JpaRepository<Note, UUID>, JpaSpecificationExecutor<Note> {

    Optional<Note> findByIdAndUserId(UUID id, UUID userId);

    List<Note> findByUserId(UUID userId);

    @Query("select count(n) from Note n where n.user.id = :userId and n.isArchived = false")
    long countNotArchived(@Param("userId") UUID userId);

    @Query("select t from Note n join n.tags t where n.user.id = :userId")
    List<String> findAllTagOccurrences(@Param("userId") UUID userId);
}
