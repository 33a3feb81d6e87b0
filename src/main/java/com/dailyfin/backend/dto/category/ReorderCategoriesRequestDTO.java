package com.dailyfin.backend.dto.category;

import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
public class ReorderCategoriesRequestDTO {

    @NotEmpty(message = "Informe ao menos uma categoria")
    @Valid
    private List<Item> categories;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @NotNull(message = "id é obrigatório")
        private UUID id;

        @NotNull(message = "order é obrigatório")
        @Min(value = 0, message = "Ordem não pode ser negativa")
        private Integer order;
    }
}
