package com.dailyfin.backend.mappers;

import java.util.ArrayList;

import com.dailyfin.backend.dto.note.NoteResponseDTO;
import com.dailyfin.backend.entities.Note;

public class NoteMapper {

    private NoteMapper() {

    }

    public static NoteResponseDTO toResponseDTO(Note n) {
        if (n == null) return null;

        NoteResponseDTO dto = new NoteResponseDTO();
        dto.setId(n.getId());
        dto.setTitle(n.getTitle());
        dto.setContent(n.getContent());
        dto.setTags(new ArrayList<>(n.getTags()));
        dto.setColor(n.getColor());
        dto.setIsPinned(n.isPinned());
        dto.setIsArchived(n.isArchived());
        dto.setCreatedAt(n.getCreatedAt());
        dto.setUpdatedAt(n.getUpdatedAt());
        return dto;
    }
}
