package com.dailyfin.backend.dto.chat;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresenceEventDTO {

    private UUID userId;
    private boolean online;
}
