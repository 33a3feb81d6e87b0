package com.dailyfin.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.analytics.CategoryBreakdownDTO;
import com.dailyfin.backend.dto.analytics.CategoryBudgetSnapshotDTO;
import com.dailyfin.backend.dto.analytics.ComparisonDTO;
import com.dailyfin.backend.dto.analytics.DailyExpenseDTO;
import com.dailyfin.backend.dto.analytics.ExpenseStatsDTO;
import com.dailyfin.backend.dto.analytics.MonthStatsDTO;
import com.dailyfin.backend.dto.analytics.PeriodTotalsDTO;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseRepository.CategorySpendingProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.DatedAmountProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.TotalCountProjection;
import com.dailyfin.backend.services.util.BudgetStatusCalculator;
import com.dailyfin.backend.services.util.DateWindows;
import com.dailyfin.backend.services.util.DateWindows.Window;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ExpenseAnalyticsService {

    private static final Logger logger = LoggerFactory.getLogger(ExpenseAnalyticsService.class);

    public static final int DEFAULT_DAYS = 30;
    public static final int MAX_DAYS = 365;

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final ExpenseRepository expenseRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ExpenseStatsDTO expenseStats(UUID userId) {
        Window thisMonth = DateWindows.currentMonth(clock);
        Window lastMonth = DateWindows.lastMonth(clock);

        TotalCountProjection current = expenseRepository.totalsSince(userId, thisMonth.start());
        TotalCountProjection previous = expenseRepository.totalsBetween(userId, lastMonth.start(), lastMonth.end());
        TotalCountProjection allTime = expenseRepository.totalsAllTime(userId);

        BigDecimal thisMonthTotal = nonNull(current.getTotal());
        BigDecimal lastMonthTotal = nonNull(previous.getTotal());

        LocalDate today = LocalDate.now(clock);
        BigDecimal average = dailyAverage(thisMonthTotal, today);
        BigDecimal projected = projectedMonthTotal(thisMonthTotal, today);

        List<CategoryBreakdownDTO> breakdown = new ArrayList<>();
        for (CategorySpendingProjection row : expenseRepository.categorySpendingSince(userId, thisMonth.start())) {
            breakdown.add(toBreakdown(row, thisMonthTotal));
        }

        logger.debug("[Analytics] Estatísticas de {}: mês={} anterior={} categorias={}",
                userId, thisMonthTotal, lastMonthTotal, breakdown.size());

        return ExpenseStatsDTO.builder()
                .thisMonth(MonthStatsDTO.builder()
                        .total(thisMonthTotal)
                        .count(count(current))
                        .average(average)
                        .projected(projected)
                        .build())
                .lastMonth(new PeriodTotalsDTO(lastMonthTotal, count(previous)))
                .allTime(new PeriodTotalsDTO(nonNull(allTime.getTotal()), count(allTime)))
                .categoryBreakdown(breakdown)
                .comparison(new ComparisonDTO(percentageChange(thisMonthTotal, lastMonthTotal)))
                .build();
    }

    /**
     * Totais por dia nos últimos {@code days} dias. Dias sem despesa não aparecem.
     */
    @Transactional(readOnly = true)
    public List<DailyExpenseDTO> dailyExpenses(UUID userId, int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new BadRequestException("O período deve estar entre 1 e " + MAX_DAYS + " dias");
        }

        LocalDateTime since = DateWindows.daysAgo(clock, days);
        Map<LocalDate, DailyExpenseDTO> byDay = new TreeMap<>();

        for (DatedAmountProjection row : expenseRepository.findDatedAmountsSince(userId, since)) {
            LocalDate day = row.getDate().toLocalDate();
            DailyExpenseDTO bucket = byDay.computeIfAbsent(day, d -> new DailyExpenseDTO(d, BigDecimal.ZERO, 0));
            bucket.setTotal(bucket.getTotal().add(row.getAmount()));
            bucket.setCount(bucket.getCount() + 1);
        }

        return new ArrayList<>(byDay.values());
    }

    /** (atual - anterior) / anterior * 100; zero quando o mês anterior não teve gastos. */
    public static BigDecimal percentageChange(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return current.subtract(previous)
                .multiply(ONE_HUNDRED)
                .divide(previous, 2, RoundingMode.HALF_UP);
    }

    static BigDecimal dailyAverage(BigDecimal monthTotal, LocalDate today) {
        return monthTotal.divide(BigDecimal.valueOf(today.getDayOfMonth()), 2, RoundingMode.HALF_UP);
    }

    // Arredonda só no final, nunca a partir da média já arredondada
    static BigDecimal projectedMonthTotal(BigDecimal monthTotal, LocalDate today) {
        return monthTotal.multiply(BigDecimal.valueOf(YearMonth.from(today).lengthOfMonth()))
                .divide(BigDecimal.valueOf(today.getDayOfMonth()), 2, RoundingMode.HALF_UP);
    }

    private CategoryBreakdownDTO toBreakdown(CategorySpendingProjection row, BigDecimal monthTotal) {
        BigDecimal total = nonNull(row.getTotal());
        BigDecimal budget = row.getCategoryBudget();

        CategoryBudgetSnapshotDTO budgetStatus = null;
        if (budget != null && budget.signum() > 0) {
            budgetStatus = CategoryBudgetSnapshotDTO.builder()
                    .budget(budget)
                    .spent(total)
                    .remaining(budget.subtract(total))
                    .percentage(BudgetStatusCalculator.percentage(total, budget))
                    .build();
        }

        return CategoryBreakdownDTO.builder()
                .categoryId(row.getCategoryId())
                .categoryName(row.getCategoryName())
                .categoryIcon(row.getCategoryIcon())
                .categoryColor(row.getCategoryColor())
                .categoryBudget(budget)
                .total(total)
                .count(row.getCount() != null ? row.getCount() : 0)
                .percentage(BudgetStatusCalculator.percentage(total, monthTotal))
                .budgetStatus(budgetStatus)
                .build();
    }

    private static long count(TotalCountProjection p) {
        return p.getCount() != null ? p.getCount() : 0;
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
