package com.dailyfin.backend.controllers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.format.annotation.DateTimeFormat;
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
import com.dailyfin.backend.dto.PaginatedResponse;
import com.dailyfin.backend.dto.analytics.DailyExpenseDTO;
import com.dailyfin.backend.dto.analytics.ExpenseStatsDTO;
import com.dailyfin.backend.dto.expense.ExpenseFilter;
import com.dailyfin.backend.dto.expense.ExpenseRequestDTO;
import com.dailyfin.backend.dto.expense.ExpenseResponseDTO;
import com.dailyfin.backend.dto.expense.ExpenseUpdateDTO;
import com.dailyfin.backend.enums.PaymentMethod;
import com.dailyfin.backend.security.SecurityService;
import com.dailyfin.backend.services.ExpenseAnalyticsService;
import com.dailyfin.backend.services.ExpenseService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;
    private final ExpenseAnalyticsService analyticsService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> create(@Valid @RequestBody ExpenseRequestDTO dto) {
        ExpenseResponseDTO created = expenseService.create(securityService.getCurrentUserId(), dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Despesa criada com sucesso"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<ExpenseResponseDTO>>> list(
            @RequestParam(required = false) UUID categoryId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false) PaymentMethod paymentMethod,
            @RequestParam(required = false) String tags,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder
    ) {
        ExpenseFilter filter = ExpenseFilter.builder()
                .categoryId(categoryId)
                .startDate(startDate)
                .endDate(endDate)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .paymentMethod(paymentMethod)
                .tags(QueryParams.splitCsv(tags))
                .page(page)
                .limit(limit)
                .sortBy(ExpenseFilter.SortField.fromParam(sortBy))
                .ascending("asc".equalsIgnoreCase(sortOrder))
                .build();

        PaginatedResponse<ExpenseResponseDTO> result = expenseService.list(securityService.getCurrentUserId(), filter);
        return ResponseEntity.ok(ApiResponse.success(result, "Despesas carregadas com sucesso"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<ExpenseStatsDTO>> stats() {
        ExpenseStatsDTO stats = analyticsService.expenseStats(securityService.getCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas carregadas com sucesso"));
    }

    @GetMapping("/daily")
    public ResponseEntity<ApiResponse<List<DailyExpenseDTO>>> daily(
            @RequestParam(defaultValue = "" + ExpenseAnalyticsService.DEFAULT_DAYS) int days
    ) {
        List<DailyExpenseDTO> daily = analyticsService.dailyExpenses(securityService.getCurrentUserId(), days);
        return ResponseEntity.ok(ApiResponse.success(daily, "Despesas diárias carregadas"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> findById(@PathVariable UUID id) {
        ExpenseResponseDTO found = expenseService.findById(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(found, "Despesa encontrada"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> update(
            @PathVariable UUID id,
            @Valid @RequestBody ExpenseUpdateDTO dto
    ) {
        ExpenseResponseDTO updated = expenseService.update(securityService.getCurrentUserId(), id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Despesa atualizada com sucesso"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        expenseService.delete(securityService.getCurrentUserId(), id);
        return ResponseEntity.ok(ApiResponse.message("Despesa removida com sucesso"));
    }
}
