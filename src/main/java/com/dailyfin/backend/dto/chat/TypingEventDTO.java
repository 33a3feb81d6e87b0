package com.dailyfin.backend.dto.chat;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Indicador de digitação. Na entrada, {@code userId} é o destinatário;
 * na saída, é quem está digitando.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypingEventDTO {

    private UUID userId;
    private boolean typing;
}
