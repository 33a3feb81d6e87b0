package com.dailyfin.backend.services;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.note.NoteFilter;
import com.dailyfin.backend.dto.note.NoteRequestDTO;
import com.dailyfin.backend.dto.note.NoteResponseDTO;
import com.dailyfin.backend.dto.note.NoteStatsDTO;
import com.dailyfin.backend.dto.note.NoteUpdateDTO;
import com.dailyfin.backend.dto.note.TagCountDTO;
import com.dailyfin.backend.entities.Note;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.NoteMapper;
import com.dailyfin.backend.repositories.NoteRepository;
import com.dailyfin.backend.repositories.NoteSpecifications;
import com.dailyfin.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class NoteService {

    static final int POPULAR_TAGS = 10;

    // Fixadas primeiro, depois as mais recentes
    private static final Sort LISTING_SORT = Sort.by(
            Sort.Order.desc("isPinned"),
            Sort.Order.desc("createdAt")
    );

    private final NoteRepository noteRepository;
    private final UserRepository userRepository;

    @Transactional
    public NoteResponseDTO create(UUID userId, NoteRequestDTO dto) {
        Note note = Note.builder()
                .user(userRepository.getReferenceById(userId))
                .title(dto.getTitle().trim())
                .content(dto.getContent())
                .isPinned(Boolean.TRUE.equals(dto.getIsPinned()))
                .isArchived(Boolean.TRUE.equals(dto.getIsArchived()))
                .build();

        if (dto.getTags() != null) note.setTags(new LinkedHashSet<>(dto.getTags()));
        if (dto.getColor() != null) note.setColor(dto.getColor());

        return NoteMapper.toResponseDTO(noteRepository.save(note));
    }

    /**
     * Sem filtro de arquivamento, lista apenas as notas não arquivadas.
     */
    @Transactional(readOnly = true)
    public List<NoteResponseDTO> findAll(UUID userId, NoteFilter filter) {
        Boolean archived = filter.getArchived() != null ? filter.getArchived() : Boolean.FALSE;

        Specification<Note> spec = Specification.where(NoteSpecifications.ownedBy(userId))
                .and(NoteSpecifications.archived(archived))
                .and(NoteSpecifications.pinned(filter.getPinned()))
                .and(NoteSpecifications.withColor(filter.getColor()))
                .and(NoteSpecifications.taggedWithAny(filter.getTags()))
                .and(NoteSpecifications.matching(filter.getSearch()));

        return noteRepository.findAll(spec, LISTING_SORT).stream()
                .map(NoteMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public NoteResponseDTO findById(UUID userId, UUID noteId) {
        return NoteMapper.toResponseDTO(findEntity(userId, noteId));
    }

    @Transactional
    public NoteResponseDTO update(UUID userId, UUID noteId, NoteUpdateDTO dto) {
        Note note = findEntity(userId, noteId);

        if (dto.getTitle() != null) note.setTitle(dto.getTitle().trim());
        if (dto.getContent() != null) note.setContent(dto.getContent());
        if (dto.getTags() != null) note.setTags(new LinkedHashSet<>(dto.getTags()));
        if (dto.getColor() != null) note.setColor(dto.getColor());
        if (dto.getIsPinned() != null) note.setPinned(dto.getIsPinned());
        if (dto.getIsArchived() != null) note.setArchived(dto.getIsArchived());

        return NoteMapper.toResponseDTO(noteRepository.save(note));
    }

    @Transactional
    public void delete(UUID userId, UUID noteId) {
        noteRepository.delete(findEntity(userId, noteId));
    }

    @Transactional
    public NoteResponseDTO togglePin(UUID userId, UUID noteId) {
        Note note = findEntity(userId, noteId);
        note.setPinned(!note.isPinned());
        return NoteMapper.toResponseDTO(noteRepository.save(note));
    }

    // Arquivar também desafixa
    @Transactional
    public NoteResponseDTO toggleArchive(UUID userId, UUID noteId) {
        Note note = findEntity(userId, noteId);
        note.setArchived(!note.isArchived());
        if (note.isArchived()) {
            note.setPinned(false);
        }
        return NoteMapper.toResponseDTO(noteRepository.save(note));
    }

    @Transactional(readOnly = true)
    public NoteStatsDTO stats(UUID userId) {
        List<Note> notes = noteRepository.findByUserId(userId);
        long archived = notes.stream().filter(Note::isArchived).count();
        long pinned = notes.stream().filter(Note::isPinned).count();

        Map<String, Long> tagCounts = noteRepository.findAllTagOccurrences(userId).stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        List<TagCountDTO> popular = tagCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(POPULAR_TAGS)
                .map(e -> new TagCountDTO(e.getKey(), e.getValue()))
                .toList();

        return NoteStatsDTO.builder()
                .total(notes.size())
                .active(notes.size() - archived)
                .archived(archived)
                .pinned(pinned)
                .totalTags(tagCounts.size())
                .popularTags(popular)
                .build();
    }

    @Transactional(readOnly = true)
    public List<String> allTags(UUID userId) {
        return noteRepository.findAllTagOccurrences(userId).stream()
                .distinct()
                .sorted(Comparator.naturalOrder())
                .toList();
    }

    private Note findEntity(UUID userId, UUID noteId) {
        return noteRepository.findByIdAndUserId(noteId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Nota não encontrada"));
    }
}
