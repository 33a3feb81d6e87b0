package com.dailyfin.backend.mappers;

import com.dailyfin.backend.dto.category.CategoryResponseDTO;
import com.dailyfin.backend.entities.Category;

public class CategoryMapper {

    private CategoryMapper() {

    }

    public static CategoryResponseDTO toResponseDTO(Category c) {
        if (c == null) return null;

        CategoryResponseDTO dto = new CategoryResponseDTO();
        dto.setId(c.getId());
        dto.setName(c.getName());
        dto.setIcon(c.getIcon());
        dto.setColor(c.getColor());
        dto.setMonthlyBudget(c.getMonthlyBudget());
        dto.setOrder(c.getDisplayOrder());
        dto.setIsDefault(c.isDefault());
        dto.setCreatedAt(c.getCreatedAt());
        dto.setUpdatedAt(c.getUpdatedAt());
        return dto;
    }
}
