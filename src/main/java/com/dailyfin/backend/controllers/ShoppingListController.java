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
import com.dailyfin.backend.dto.shopping.ShoppingItemRequestDTO;
import com.dailyfin.backend.dto.shopping.ShoppingItemUpdateDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListRequestDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListResponseDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListUpdateDTO;
import com.dailyfin.backend.dto.shopping.ShoppingStatsDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.ShoppingListService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Listas de compras ("bazar").
 */
@RestController
@RequestMapping("/api/bazar")
@RequiredArgsConstructor
public class ShoppingListController {

    private final ShoppingListService shoppingListService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> create(@Valid @RequestBody ShoppingListRequestDTO dto) {
        ShoppingListResponseDTO created = shoppingListService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Lista criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShoppingListResponseDTO>>> findAll(
            @RequestParam(required = false) Boolean isCompleted,
            @RequestParam(required = false) String search
    ) {
        List<ShoppingListResponseDTO> lists = shoppingListService.findAll(
                securityService.getCurrentUserId(), isCompleted, search);
        return ResponseEntity.ok(ApiResponse.success(lists, "Listas carregadas com sucesso"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<ShoppingStatsDTO>> stats() {
        ShoppingStatsDTO stats = shoppingListService.stats(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas de compras carregadas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> findById(@PathVariable UUID id) {
        ShoppingListResponseDTO list = shoppingListService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(list, "Lista encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody ShoppingListUpdateDTO dto
    ) {
        ShoppingListResponseDTO updated = shoppingListService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Lista atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        shoppingListService.delete(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.message("Lista removida com sucesso"));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> addItem(
            @PathVariable UUID id,
            @Valid @RequestBody ShoppingItemRequestDTO dto
    ) {
        ShoppingListResponseDTO list = shoppingListService.addItem(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(list, "Item adicionado"));
    }

    @PutMapping("/{id}/items/{itemId}")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> updateItem(
            @PathVariable UUID id,
            @PathVariable UUID itemId,
            @Valid @RequestBody ShoppingItemUpdateDTO dto
    ) {
        ShoppingListResponseDTO list = shoppingListService.updateItem(securityService.getCurrentUserId(), id, itemId, dto);
        return ResponseEntity.ok(ApiResponse.success(list, "Item atualizado"));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> deleteItem(
            @PathVariable UUID id,
            @PathVariable UUID itemId
    ) {
        ShoppingListResponseDTO list = shoppingListService.deleteItem(securityService.getCurrentUserId(), id, itemId);
        return ResponseEntity.ok(ApiResponse.success(list, "Item removido"));
    }

    @PatchMapping("/{id}/items/{itemId}/toggle")
    public ResponseEntity<ApiResponse<ShoppingListResponseDTO>> toggleItem(
            @PathVariable UUID id,
            @PathVariable UUID itemId
    ) {
        ShoppingListResponseDTO list = shoppingListService.toggleItemPurchase(securityService.getCurrentUserId(), id, itemId);
        return ResponseEntity.ok(ApiResponse.success(list, "Item atualizado"));
    }
}
