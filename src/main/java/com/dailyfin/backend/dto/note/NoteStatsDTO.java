package com.dailyfin.backend.dto.note;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteStatsDTO {

    private long total;
    private long active;
    private long archived;
    private long pinned;
    private int totalTags;
    private List<TagCountDTO> popularTags;
}
