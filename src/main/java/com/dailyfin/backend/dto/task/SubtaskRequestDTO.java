package com.dailyfin.backend.dto.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskRequestDTO {

    @NotBlank(message = "Título da subtarefa é obrigatório")
    @Size(min = 2, max = 200, message = "Título da subtarefa deve ter entre 2 e 200 caracteres")
    private String title;
}
