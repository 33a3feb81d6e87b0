package com.dailyfin.backend.dto.dashboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuickStatsDTO {

    private long unreadMessages;
    private long activeShoppingLists;
    private long totalNotes;
}
