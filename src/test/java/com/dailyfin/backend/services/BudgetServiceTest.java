package com.dailyfin.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import com.dailyfin.backend.dto.budget.BudgetStatusDTO;
import com.dailyfin.backend.dto.budget.BudgetSummaryDTO;
import com.dailyfin.backend.entities.Category;
import com.dailyfin.backend.enums.BudgetStatusLevel;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.repositories.CategoryRepository;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseRepository.CategoryTotalProjection;

@ExtendWith(MockitoExtension.class)
class BudgetServiceTest {

    // 15/03/2024 10:00
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private NotificationService notificationService;

    private BudgetService budgetService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        budgetService = new BudgetService(categoryRepository, expenseRepository, notificationService, CLOCK);
    }

    @Test
    void categoryBudgetStatus_warningLevel_sendsAlertAndUsesMonthWindow() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(expenseRepository.sumForCategoryBetween(
                eq(userId), eq(food.getId()),
                eq(LocalDateTime.of(2024, 3, 1, 0, 0)),
                any(LocalDateTime.class)))
                .thenReturn(new BigDecimal("420.00"));

        BudgetStatusDTO status = budgetService.categoryBudgetStatus(userId, food.getId());

        assertEquals(new BigDecimal("84.00"), status.getPercentage());
        assertEquals(BudgetStatusLevel.WARNING, status.getStatus());
        assertEquals(new BigDecimal("80.00"), status.getRemaining());
        assertEquals("#F39C12", status.getColor());
        verify(notificationService).sendBudgetAlert(userId, "Food", new BigDecimal("84.00"));
    }

    @Test
    void categoryBudgetStatus_repeatedReadsAboveThreshold_alertEveryTime() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(expenseRepository.sumForCategoryBetween(eq(userId), eq(food.getId()), any(), any()))
                .thenReturn(new BigDecimal("450"));

        budgetService.categoryBudgetStatus(userId, food.getId());
        budgetService.categoryBudgetStatus(userId, food.getId());

        verify(notificationService, times(2)).sendBudgetAlert(userId, "Food", new BigDecimal("90.00"));
    }

    @Test
    void categoryBudgetStatus_notificationRejected_stillReturnsStatus() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(expenseRepository.sumForCategoryBetween(eq(userId), eq(food.getId()), any(), any()))
                .thenReturn(new BigDecimal("450"));
        doThrow(new TaskRejectedException("fila cheia"))
                .when(notificationService).sendBudgetAlert(any(), any(), any());

        BudgetStatusDTO status = budgetService.categoryBudgetStatus(userId, food.getId());

        assertEquals(BudgetStatusLevel.WARNING, status.getStatus());
        assertEquals(new BigDecimal("90.00"), status.getPercentage());
    }

    @Test
    void categoryBudgetStatus_belowThreshold_doesNotAlert() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(expenseRepository.sumForCategoryBetween(eq(userId), eq(food.getId()), any(), any()))
                .thenReturn(new BigDecimal("100"));

        BudgetStatusDTO status = budgetService.categoryBudgetStatus(userId, food.getId());

        assertEquals(BudgetStatusLevel.SAFE, status.getStatus());
        verify(notificationService, never()).sendBudgetAlert(any(), any(), any());
    }

    @Test
    void categoryBudgetStatus_exceeded_hasNegativeRemaining() {
        Category rent = category("Rent", "1000");
        when(categoryRepository.findByIdAndUserId(rent.getId(), userId)).thenReturn(Optional.of(rent));
        when(expenseRepository.sumForCategoryBetween(eq(userId), eq(rent.getId()), any(), any()))
                .thenReturn(new BigDecimal("1250"));

        BudgetStatusDTO status = budgetService.categoryBudgetStatus(userId, rent.getId());

        assertEquals(BudgetStatusLevel.EXCEEDED, status.getStatus());
        assertEquals(new BigDecimal("125.00"), status.getPercentage());
        assertEquals(new BigDecimal("-250"), status.getRemaining());
    }

    @Test
    void categoryBudgetStatus_withoutBudget_throwsNotFound() {
        Category misc = category("Other", null);
        when(categoryRepository.findByIdAndUserId(misc.getId(), userId)).thenReturn(Optional.of(misc));

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> budgetService.categoryBudgetStatus(userId, misc.getId()));

        assertEquals("Orçamento não definido para esta categoria", ex.getMessage());
    }

    @Test
    void categoryBudgetStatus_unknownCategory_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(categoryRepository.findByIdAndUserId(id, userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> budgetService.categoryBudgetStatus(userId, id));
    }

    @Test
    void budgetSummary_sortsByPercentageAndAggregatesTotals() {
        Category food = category("Food", "500");
        Category transport = category("Transport", "200");
        Category health = category("Health", "300");
        when(categoryRepository.findWithPositiveBudget(userId)).thenReturn(List.of(food, transport, health));
        when(expenseRepository.sumByCategoriesBetween(eq(userId), anyCollection(), any(), any()))
                .thenReturn(List.of(
                        total(food.getId(), "250"),
                        total(transport.getId(), "220")
                ));

        BudgetSummaryDTO summary = budgetService.budgetSummary(userId);

        assertEquals(3, summary.getCategoriesWithBudget());
        assertEquals(1, summary.getCategoriesOverBudget());
        assertEquals(new BigDecimal("1000"), summary.getTotalBudget());
        assertEquals(new BigDecimal("470"), summary.getTotalSpent());
        assertEquals(new BigDecimal("530"), summary.getTotalRemaining());
        assertEquals(new BigDecimal("47.00"), summary.getOverallPercentage());

        List<BudgetStatusDTO> categories = summary.getCategories();
        assertEquals("Transport", categories.get(0).getCategoryName());
        assertEquals("Food", categories.get(1).getCategoryName());
        assertEquals("Health", categories.get(2).getCategoryName());
        assertEquals(0, BigDecimal.ZERO.compareTo(categories.get(2).getSpent()));
    }

    @Test
    void budgetSummary_noBudgetedCategories_returnsEmptySummary() {
        when(categoryRepository.findWithPositiveBudget(userId)).thenReturn(List.of());

        BudgetSummaryDTO summary = budgetService.budgetSummary(userId);

        assertEquals(0, summary.getCategoriesWithBudget());
        assertTrue(summary.getCategories().isEmpty());
        verify(expenseRepository, never()).sumByCategoriesBetween(any(), anyCollection(), any(), any());
    }

    @Test
    void budgetAlerts_returnsOnlyWarningAndExceeded() {
        Category food = category("Food", "100");
        Category fun = category("Entertainment", "100");
        Category bills = category("Bills", "100");
        when(categoryRepository.findWithPositiveBudget(userId)).thenReturn(List.of(food, fun, bills));
        when(expenseRepository.sumByCategoriesBetween(eq(userId), anyCollection(), any(), any()))
                .thenReturn(List.of(
                        total(food.getId(), "80"),
                        total(fun.getId(), "10"),
                        total(bills.getId(), "130")
                ));

        List<BudgetStatusDTO> alerts = budgetService.budgetAlerts(userId);

        assertEquals(2, alerts.size());
        assertEquals(BudgetStatusLevel.EXCEEDED, alerts.get(0).getStatus());
        assertEquals(BudgetStatusLevel.WARNING, alerts.get(1).getStatus());
    }

    @Test
    void updateCategoryBudget_nullRemovesBudget() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        var response = budgetService.updateCategoryBudget(userId, food.getId(), null);

        assertNull(response.getMonthlyBudget());
        assertNull(food.getMonthlyBudget());
    }

    @Test
    void updateCategoryBudget_removedBudget_statusThenThrowsNotFound() {
        Category food = category("Food", "500");
        when(categoryRepository.findByIdAndUserId(food.getId(), userId)).thenReturn(Optional.of(food));
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        budgetService.updateCategoryBudget(userId, food.getId(), null);

        assertThrows(ResourceNotFoundException.class,
                () -> budgetService.categoryBudgetStatus(userId, food.getId()));
        verify(notificationService, never()).sendBudgetAlert(any(), any(), any());
    }

    private Category category(String name, String budget) {
        return Category.builder()
                .id(UUID.randomUUID())
                .name(name)
                .monthlyBudget(budget != null ? new BigDecimal(budget) : null)
                .build();
    }

    private CategoryTotalProjection total(UUID categoryId, String amount) {
        return new CategoryTotalProjection() {
            @Override
            public UUID getCategoryId() {
                return categoryId;
            }

            @Override
            public BigDecimal getTotal() {
                return new BigDecimal(amount);
            }

            @Override
            public Long getCount() {
                return 1L;
            }
        };
    }
}
