package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.budget.BudgetStatusDTO;
import com.dailyfin.backend.dto.budget.BudgetSummaryDTO;
import com.dailyfin.backend.dto.budget.UpdateBudgetRequestDTO;
import com.dailyfin.backend.dto.category.CategoryResponseDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.BudgetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/budget")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;
    private final SecurityService securityService;

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<BudgetSummaryDTO>> summary() {
        BudgetSummaryDTO summary = budgetService.budgetSummary(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(summary, "Resumo do orçamento carregado"));
    }

    @GetMapping("/alerts")
    public ResponseEntity<ApiResponse<List<BudgetStatusDTO>>> alerts() {
        List<BudgetStatusDTO> alerts = budgetService.budgetAlerts(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(alerts, "Alertas de orçamento carregados"));
    }

    @GetMapping("/category/{categoryId}")
    public ResponseEntity<ApiResponse<BudgetStatusDTO>> categoryStatus(@PathVariable UUID categoryId) {
        BudgetStatusDTO status = budgetService.categoryBudgetStatus(securityService.getCurrentUserId(), categoryId);
        return ResponseEntity.ok(ApiResponse.success(status, "Status do orçamento carregado"));
    }

    @PutMapping("/category/{categoryId}")
    public ResponseEntity<ApiResponse<CategoryResponseDTO>> updateCategoryBudget(
            @PathVariable UUID categoryId,
            @Valid @RequestBody UpdateBudgetRequestDTO request
    ) {
        CategoryResponseDTO updated = budgetService.updateCategoryBudget(
                securityService.getCurrentUserId(), categoryId, request.getBudget());
        return ResponseEntity.ok(ApiResponse.success(updated, "Orçamento atualizado com sucesso"));
    }
}
