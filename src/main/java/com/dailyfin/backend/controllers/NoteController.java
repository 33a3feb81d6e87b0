package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.note.NoteFilter;
import com.dailyfin.backend.dto.note.NoteRequestDTO;
import com.dailyfin.backend.dto.note.NoteResponseDTO;
import com.dailyfin.backend.dto.note.NoteStatsDTO;
import com.dailyfin.backend.dto.note.NoteUpdateDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.NoteService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/notes")
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<NoteResponseDTO>> create(@Valid @RequestBody NoteRequestDTO dto) {
        NoteResponseDTO created = noteService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Nota criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<NoteResponseDTO>>> findAll(
            @RequestParam(required = false) Boolean isArchived,
            @RequestParam(required = false) Boolean isPinned,
            @RequestParam(required = false) String tags,
            @RequestParam(required = false) String color,
            @RequestParam(required = false) String search
    ) {
        NoteFilter filter = NoteFilter.builder()
                .archived(isArchived)
                .pinned(isPinned)
                .tags(QueryParams.splitCsv(tags))
                .color(color)
                .search(search)
                .build();

        List<NoteResponseDTO> notes = noteService.findAll(securityService.getCurrentUserId(), filter);
        return ResponseEntity.ok(ApiResponse.success(notes, "Notas carregadas com sucesso"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<NoteStatsDTO>> stats() {
        NoteStatsDTO stats = noteService.stats(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas de notas carregadas"));
    }

    @GetMapping("/tags")
    public ResponseEntity<ApiResponse<List<String>>> tags() {
        List<String> tags = noteService.allTags(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(tags, "Tags carregadas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<NoteResponseDTO>> findById(@PathVariable UUID id) {
        NoteResponseDTO note = noteService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(note, "Nota encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<NoteResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody NoteUpdateDTO dto
    ) {
        NoteResponseDTO updated = noteService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Nota atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        noteService.delete(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.message("Nota removida com sucesso"));
    }

    @PatchMapping("/{id}/pin")
    public ResponseEntity<ApiResponse<NoteResponseDTO>> togglePin(@PathVariable UUID id) {
        NoteResponseDTO note = noteService.togglePin(securityService.getCurrentUserId(), id);
        String msg = Boolean.TRUE.equals(note.getIsPinned()) ? "Nota fixada" : "Nota desafixada";
        return ResponseEntity.ok(ApiResponse.success(note, msg));
    }

    @PatchMapping("/{id}/archive")
    public ResponseEntity<ApiResponse<NoteResponseDTO>> toggleArchive(@PathVariable UUID id) {
        NoteResponseDTO note = noteService.toggleArchive(securityService.getCurrentUserId(), id);
        String msg = Boolean.TRUE.equals(note.getIsArchived()) ? "Nota arquivada" : "Nota desarquivada";
        return ResponseEntity.ok(ApiResponse.success(note, msg));
    }
}
