package com.dailyfin.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dailyfin.backend.dto.analytics.CategoryBreakdownDTO;
import com.dailyfin.backend.dto.analytics.DailyExpenseDTO;
import com.dailyfin.backend.dto.analytics.ExpenseStatsDTO;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseRepository.CategorySpendingProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.DatedAmountProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.TotalCountProjection;

@ExtendWith(MockitoExtension.class)
class ExpenseAnalyticsServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ExpenseRepository expenseRepository;

    private ExpenseAnalyticsService analyticsService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        analyticsService = new ExpenseAnalyticsService(expenseRepository, CLOCK);
    }

    @Test
    void expenseStats_computesAverageProjectionAndComparison() {
        UUID foodId = UUID.randomUUID();
        UUID funId = UUID.randomUUID();

        when(expenseRepository.totalsSince(userId, LocalDateTime.of(2024, 3, 1, 0, 0)))
                .thenReturn(totals("1500", 12));
        when(expenseRepository.totalsBetween(eq(userId), eq(LocalDateTime.of(2024, 2, 1, 0, 0)), any()))
                .thenReturn(totals("1000", 8));
        when(expenseRepository.totalsAllTime(userId)).thenReturn(totals("9000", 70));
        when(expenseRepository.categorySpendingSince(userId, LocalDateTime.of(2024, 3, 1, 0, 0)))
                .thenReturn(List.of(
                        spending(foodId, "Food", "1200", "1000", 9),
                        spending(funId, "Entertainment", "300", null, 3)
                ));

        ExpenseStatsDTO stats = analyticsService.expenseStats(userId);

        assertEquals(new BigDecimal("1500"), stats.getThisMonth().getTotal());
        assertEquals(12, stats.getThisMonth().getCount());
        assertEquals(new BigDecimal("100.00"), stats.getThisMonth().getAverage());
        assertEquals(new BigDecimal("3100.00"), stats.getThisMonth().getProjected());
        assertEquals(new BigDecimal("1000"), stats.getLastMonth().getTotal());
        assertEquals(70, stats.getAllTime().getCount());
        assertEquals(new BigDecimal("50.00"), stats.getComparison().getPercentageChange());

        CategoryBreakdownDTO food = stats.getCategoryBreakdown().get(0);
        assertEquals(new BigDecimal("80.00"), food.getPercentage());
        assertNotNull(food.getBudgetStatus());
        assertEquals(new BigDecimal("120.00"), food.getBudgetStatus().getPercentage());
        assertEquals(new BigDecimal("-200"), food.getBudgetStatus().getRemaining());

        CategoryBreakdownDTO fun = stats.getCategoryBreakdown().get(1);
        assertEquals(new BigDecimal("20.00"), fun.getPercentage());
        assertNull(fun.getBudgetStatus());
    }

    @Test
    void expenseStats_noPreviousSpending_reportsZeroChange() {
        when(expenseRepository.totalsSince(eq(userId), any())).thenReturn(totals("300", 2));
        when(expenseRepository.totalsBetween(eq(userId), any(), any())).thenReturn(totals("0", 0));
        when(expenseRepository.totalsAllTime(userId)).thenReturn(totals("300", 2));
        when(expenseRepository.categorySpendingSince(eq(userId), any())).thenReturn(List.of());

        ExpenseStatsDTO stats = analyticsService.expenseStats(userId);

        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getComparison().getPercentageChange()));
        assertTrue(stats.getCategoryBreakdown().isEmpty());
    }

    @Test
    void expenseStats_projectionUsesUnroundedDailyAverage() {
        Clock earlyMarch = Clock.fixed(Instant.parse("2024-03-03T09:00:00Z"), ZoneOffset.UTC);
        ExpenseAnalyticsService service = new ExpenseAnalyticsService(expenseRepository, earlyMarch);

        when(expenseRepository.totalsSince(eq(userId), any())).thenReturn(totals("100", 3));
        when(expenseRepository.totalsBetween(eq(userId), any(), any())).thenReturn(totals("0", 0));
        when(expenseRepository.totalsAllTime(userId)).thenReturn(totals("100", 3));
        when(expenseRepository.categorySpendingSince(eq(userId), any())).thenReturn(List.of());

        ExpenseStatsDTO stats = service.expenseStats(userId);

        assertEquals(new BigDecimal("33.33"), stats.getThisMonth().getAverage());
        assertEquals(new BigDecimal("1033.33"), stats.getThisMonth().getProjected());
    }

    @Test
    void expenseStats_zeroBudgetCategory_hasNoBudgetStatus() {
        when(expenseRepository.totalsSince(eq(userId), any())).thenReturn(totals("80", 2));
        when(expenseRepository.totalsBetween(eq(userId), any(), any())).thenReturn(totals("0", 0));
        when(expenseRepository.totalsAllTime(userId)).thenReturn(totals("80", 2));
        when(expenseRepository.categorySpendingSince(eq(userId), any()))
                .thenReturn(List.of(spending(UUID.randomUUID(), "Transport", "80", "0", 2)));

        ExpenseStatsDTO stats = analyticsService.expenseStats(userId);

        CategoryBreakdownDTO transport = stats.getCategoryBreakdown().get(0);
        assertEquals(new BigDecimal("100.00"), transport.getPercentage());
        assertNull(transport.getBudgetStatus());
    }

    @Test
    void percentageChange_decrease_isNegative() {
        BigDecimal change = ExpenseAnalyticsService.percentageChange(new BigDecimal("750"), new BigDecimal("1000"));

        assertEquals(new BigDecimal("-25.00"), change);
    }

    @Test
    void dailyExpenses_groupsByDayInAscendingOrder() {
        when(expenseRepository.findDatedAmountsSince(userId, LocalDateTime.of(2024, 3, 8, 10, 0)))
                .thenReturn(List.of(
                        dated(LocalDateTime.of(2024, 3, 9, 8, 30), "10"),
                        dated(LocalDateTime.of(2024, 3, 9, 19, 0), "15.50"),
                        dated(LocalDateTime.of(2024, 3, 12, 12, 0), "40")
                ));

        List<DailyExpenseDTO> daily = analyticsService.dailyExpenses(userId, 7);

        assertEquals(2, daily.size());
        assertEquals(LocalDate.of(2024, 3, 9), daily.get(0).getDate());
        assertEquals(new BigDecimal("25.50"), daily.get(0).getTotal());
        assertEquals(2, daily.get(0).getCount());
        assertEquals(LocalDate.of(2024, 3, 12), daily.get(1).getDate());
    }

    @Test
    void dailyExpenses_outOfRange_throwsBadRequest() {
        assertThrows(BadRequestException.class, () -> analyticsService.dailyExpenses(userId, 0));
        assertThrows(BadRequestException.class, () -> analyticsService.dailyExpenses(userId, 366));
        verifyNoInteractions(expenseRepository);
    }

    private TotalCountProjection totals(String total, long count) {
        return new TotalCountProjection() {
            @Override
            public BigDecimal getTotal() {
                return new BigDecimal(total);
            }

            @Override
            public Long getCount() {
                return count;
            }
        };
    }

    private CategorySpendingProjection spending(UUID id, String name, String total, String budget, long count) {
        return new CategorySpendingProjection() {
            @Override
            public UUID getCategoryId() {
                return id;
            }

            @Override
            public String getCategoryName() {
                return name;
            }

            @Override
            public String getCategoryIcon() {
                return "category";
            }

            @Override
            public String getCategoryColor() {
                return "#95A5A6";
            }

            @Override
            public BigDecimal getCategoryBudget() {
                return budget != null ? new BigDecimal(budget) : null;
            }

            @Override
            public BigDecimal getTotal() {
                return new BigDecimal(total);
            }

            @Override
            public Long getCount() {
                return count;
            }
        };
    }

    private DatedAmountProjection dated(LocalDateTime date, String amount) {
        return new DatedAmountProjection() {
            @Override
            public LocalDateTime getDate() {
                return date;
            }

            @Override
            public BigDecimal getAmount() {
                return new BigDecimal(amount);
            }
        };
    }
}
