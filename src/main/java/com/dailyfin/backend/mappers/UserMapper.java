package com.dailyfin.backend.mappers;

import com.dailyfin.backend.dto.auth.UserResponseDTO;
import com.dailyfin.backend.dto.auth.UserSummaryDTO;
import com.dailyfin.backend.entities.User;

public class UserMapper {

    private UserMapper() {

    }

    // Entidade -> DTO de resposta (Não expoe senha nem tokens de dispositivo)
    public static UserResponseDTO toResponseDTO(User u) {
        if (u == null) return null;

        UserResponseDTO dto = new UserResponseDTO();

        dto.setId(u.getId());
        dto.setName(u.getName());
        dto.setEmail(u.getEmail());
        dto.setRole(u.getRole());
        dto.setCurrency(u.getCurrency());
        dto.setAvatar(u.getAvatar());
        dto.setPhone(u.getPhone());
        dto.setLastLoginAt(u.getLastLoginAt());
        dto.setCreatedAt(u.getCreatedAt());

        return dto;
    }

    public static UserSummaryDTO toSummaryDTO(User u) {
        if (u == null) return null;

        return UserSummaryDTO.builder()
                .id(u.getId())
                .name(u.getName())
                .email(u.getEmail())
                .avatar(u.getAvatar())
                .build();
    }
}
