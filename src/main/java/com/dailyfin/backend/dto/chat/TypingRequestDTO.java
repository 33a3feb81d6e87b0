package com.dailyfin.backend.dto.chat;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypingRequestDTO {

    @NotNull(message = "Destinatário é obrigatório")
    private UUID receiverId;

    private boolean typing;
}
