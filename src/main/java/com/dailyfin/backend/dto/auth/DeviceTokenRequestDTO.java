package com.dailyfin.backend.dto.auth;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DeviceTokenRequestDTO {

    @NotBlank(message = "Token do dispositivo é obrigatório")
    private String token;
}
