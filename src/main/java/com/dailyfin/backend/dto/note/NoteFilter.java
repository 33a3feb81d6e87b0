package com.dailyfin.backend.dto.note;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filtros da listagem de notas. Sem {@code archived} informado, apenas notas ativas são retornadas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteFilter {

    private Boolean archived;
    private Boolean pinned;
    private List<String> tags;
    private String color;
    private String search;
}
