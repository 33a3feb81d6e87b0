package com.dailyfin.backend.dto.auth;

import java.time.LocalDateTime;
import java.util.UUID;

import com.dailyfin.backend.enums.Role;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponseDTO {

    private UUID id;
    private String name;
    private String email;
    private Role role;
    private String currency;
    private String avatar;
    private String phone;
    private LocalDateTime lastLoginAt;
    private LocalDateTime createdAt;
}
