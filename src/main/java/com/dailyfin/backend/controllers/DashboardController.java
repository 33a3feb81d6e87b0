package com.dailyfin.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dailyfin.backend.dto.ApiResponse;
import com.dailyfin.backend.dto.dashboard.DashboardDTO;
import com.dailyfin.backend.dto.dashboard.FinancialSummaryDTO;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.DashboardService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;
    private final SecurityService securityService;

    @GetMapping
    public ResponseEntity<ApiResponse<DashboardDTO>> dashboard() {
        DashboardDTO data = dashboardService.dashboardData(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(data, "Dashboard carregado com sucesso"));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<FinancialSummaryDTO>> summary() {
        FinancialSummaryDTO summary = dashboardService.financialSummary(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(summary, "Resumo financeiro carregado"));
    }
}
