package com.dailyfin.backend.dto.auth;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UpdateProfileRequestDTO {

    @Size(min = 2, max = 50, message = "Nome deve ter entre 2 e 50 caracteres")
    private String name;

    @Size(max = 20, message = "Telefone muito longo")
    private String phone;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Moeda deve ser um código ISO de 3 letras")
    private String currency;

    @Size(max = 500, message = "URL do avatar muito longa")
    private String avatar;
}
