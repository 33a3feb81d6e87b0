package com.dailyfin.backend.dto.chat;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequestDTO {

    @NotNull(message = "Destinatário é obrigatório")
    private UUID receiverId;

    @NotBlank(message = "Mensagem não pode ser vazia")
    @Size(max = 5000, message = "Mensagem não pode passar de 5000 caracteres")
    private String message;
}
