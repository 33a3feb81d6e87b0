package com.dailyfin.backend.dto.note;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class NoteRequestDTO {

    @NotBlank(message = "Título é obrigatório")
    @Size(max = 200, message = "Título não pode passar de 200 caracteres")
    private String title;

    @NotBlank(message = "Conteúdo é obrigatório")
    @Size(max = 50000, message = "Conteúdo não pode passar de 50000 caracteres")
    private String content;

    @Size(max = 20, message = "Máximo de 20 tags")
    private List<@Size(max = 30, message = "Tag não pode passar de 30 caracteres") String> tags;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Cor deve estar no formato hexadecimal")
    private String color;

    private Boolean isPinned;

    private Boolean isArchived;
}
