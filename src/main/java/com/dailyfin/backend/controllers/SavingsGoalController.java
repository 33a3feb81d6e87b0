package com.dailyfin.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.savings.ContributionDTO;
import com.dailyfin.backend.dto.savings.ContributionRequestDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalRequestDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalResponseDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalUpdateDTO;
import com.dailyfin.backend.dto.savings.SavingsStatsDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.SavingsGoalService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/savings")
@RequiredArgsConstructor
public class SavingsGoalController {

    private final SavingsGoalService savingsGoalService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> create(@Valid @RequestBody SavingsGoalRequestDTO dto) {
        SavingsGoalResponseDTO created = savingsGoalService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Meta criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<SavingsGoalResponseDTO>>> findAll(
            @RequestParam(defaultValue = "false") boolean includeCompleted
    ) {
        List<SavingsGoalResponseDTO> goals = savingsGoalService.findAll(securityService.getCurrentUserId(), includeCompleted);
        return ResponseEntity.ok(ApiResponse.success(goals, "Metas carregadas com sucesso"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<SavingsStatsDTO>> stats() {
        SavingsStatsDTO stats = savingsGoalService.stats(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas de economia carregadas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> findById(@PathVariable UUID id) {
        SavingsGoalResponseDTO goal = savingsGoalService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(goal, "Meta encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody SavingsGoalUpdateDTO dto
    ) {
        SavingsGoalResponseDTO updated = savingsGoalService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Meta atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        savingsGoalService.delete(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.message("Meta removida com sucesso"));
    }

    @PostMapping("/{id}/contributions")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> addContribution(
            @PathVariable UUID id,
            @Valid @RequestBody ContributionRequestDTO dto
    ) {
        SavingsGoalResponseDTO goal = savingsGoalService.addContribution(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(goal, "Contribuição registrada"));
    }

    @GetMapping("/{id}/contributions")
    public ResponseEntity<ApiResponse<List<ContributionDTO>>> contributions(@PathVariable UUID id) {
        List<ContributionDTO> history = savingsGoalService.contributions(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(history, "Histórico de contribuições carregado"));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> withdraw(
            @PathVariable UUID id,
            @Valid @RequestBody ContributionRequestDTO dto
    ) {
        SavingsGoalResponseDTO goal = savingsGoalService.withdraw(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(goal, "Retirada registrada"));
    }
}
