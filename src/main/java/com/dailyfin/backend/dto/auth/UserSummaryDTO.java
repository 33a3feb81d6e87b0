package com.dailyfin.backend.dto.auth;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dados públicos de um usuário (busca de contatos, conversas).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummaryDTO {

    private UUID id;
    private String name;
    private String email;
    private String avatar;
}
