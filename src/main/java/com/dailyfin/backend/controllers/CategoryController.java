package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.category.CategoryDeletionCheckDTO;
import com.dailyfin.backend.dto.category.CategoryDeletionResultDTO;
import com.dailyfin.backend.dto.category.CategoryRequestDTO;
import com.dailyfin.backend.dto.category.CategoryResponseDTO;
import com.dailyfin.backend.dto.category.CategoryUpdateDTO;
import com.dailyfin.backend.dto.category.ReorderCategoriesRequestDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.CategoryService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> create(@Valid @RequestBody CategoryRequestDTO dto) {
        CategoryResponseDTO created = categoryService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Categoria criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<CategoryResponseDTO>>> findAll() {
        List<CategoryResponseDTO> categories = categoryService.findAll(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(categories, "Categorias carregadas com sucesso"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> findById(@PathVariable UUID id) {
        CategoryResponseDTO found = categoryService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(found, "Categoria encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody CategoryUpdateDTO dto
    ) {
        CategoryResponseDTO updated = categoryService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Categoria atualizada com sucesso"));
    }

    @GetMapping("/{id}/check-deletion")
    public ResponseEntity<ApiResponse<CategoryDeletionCheckDTO>> checkDeletion(@PathVariable UUID id) {
        CategoryDeletionCheckDTO check = categoryService.checkDeletion(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(check, check.getMessage()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<CategoryDeletionResultDTO>> delete(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean confirmed
    ) {
        CategoryDeletionResultDTO result = categoryService.delete(securityService.getCurrentUserId(), id, confirmed);
        return ResponseEntity.ok(ApiResponse.success(result, "Categoria removida com sucesso"));
    }

    @PatchMapping("/reorder")
    public ResponseEntity<ApiResponse<Void>> reorder(@Valid @RequestBody ReorderCategoriesRequestDTO dto) {
        categoryService.reorder(securityService.getCurrentUserId(), dto);
        return ResponseEntity.ok(ApiResponse.message("Categorias reordenadas"));
    }
}
