package com.dailyfin.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.dailyfin.backend.dto.budget.BudgetStatusDTO;
import com.dailyfin.backend.dto.dashboard.CategorySpendingDTO;
import com.dailyfin.backend.dto.dashboard.ChartsDTO;
import com.dailyfin.backend.dto.dashboard.DashboardDTO;
import com.dailyfin.backend.dto.dashboard.FinancialOverviewDTO;
import com.dailyfin.backend.dto.dashboard.FinancialSummaryDTO;
import com.dailyfin.backend.dto.dashboard.QuickStatsDTO;
import com.dailyfin.backend.dto.dashboard.RecentActivityDTO;
import com.dailyfin.backend.dto.dashboard.RecentContributionDTO;
import com.dailyfin.backend.dto.dashboard.SavingsOverviewDTO;
import com.dailyfin.backend.dto.dashboard.TaskOverviewDTO;
import com.dailyfin.backend.dto.dashboard.TopCategoryDTO;
import com.dailyfin.backend.dto.dashboard.TrendPointDTO;
import com.dailyfin.backend.enums.ChangeType;
import com.dailyfin.backend.enums.TaskStatus;
import com.dailyfin.backend.mappers.ExpenseMapper;
import com.dailyfin.backend.mappers.TaskMapper;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseRepository.CategorySpendingProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.DatedAmountProjection;
import com.dailyfin.backend.repositories.ExpenseRepository.TotalCountProjection;
import com.dailyfin.backend.repositories.MessageRepository;
import com.dailyfin.backend.repositories.NoteRepository;
import com.dailyfin.backend.repositories.SavingsGoalRepository;
import com.dailyfin.backend.repositories.SavingsGoalRepository.ActiveSavingsProjection;
import com.dailyfin.backend.repositories.ShoppingListRepository;
import com.dailyfin.backend.repositories.TaskRepository;
import com.dailyfin.backend.services.util.BudgetStatusCalculator;
import com.dailyfin.backend.services.util.DateWindows;
import com.dailyfin.backend.services.util.DateWindows.Window;

/**
 * Monta o snapshot da tela inicial. Cada bloco roda em paralelo no
 * {@code dashboardTaskExecutor}, dentro da sua própria transação somente leitura.
 */
@Service
public class DashboardService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

    static final int RECENT_LIMIT = 5;
    static final int TOP_CATEGORIES = 5;
    static final int TREND_DAYS = 7;

    private final BudgetService budgetService;
    private final ExpenseRepository expenseRepository;
    private final SavingsGoalRepository savingsGoalRepository;
    private final TaskRepository taskRepository;
    private final MessageRepository messageRepository;
    private final ShoppingListRepository shoppingListRepository;
    private final NoteRepository noteRepository;
    private final Executor executor;
    private final TransactionTemplate readOnlyTx;
    private final Clock clock;

    public DashboardService(
            BudgetService budgetService,
            ExpenseRepository expenseRepository,
            SavingsGoalRepository savingsGoalRepository,
            TaskRepository taskRepository,
            MessageRepository messageRepository,
            ShoppingListRepository shoppingListRepository,
            NoteRepository noteRepository,
            @Qualifier("dashboardTaskExecutor") Executor executor,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.budgetService = budgetService;
        this.expenseRepository = expenseRepository;
        this.savingsGoalRepository = savingsGoalRepository;
        this.taskRepository = taskRepository;
        this.messageRepository = messageRepository;
        this.shoppingListRepository = shoppingListRepository;
        this.noteRepository = noteRepository;
        this.executor = executor;
        this.readOnlyTx = new TransactionTemplate(transactionManager);
        this.readOnlyTx.setReadOnly(true);
        this.clock = clock;
    }

    public DashboardDTO dashboardData(UUID userId) {
        logger.info("[Dashboard] 🔄 Montando dashboard para userId: {}", userId);
        long started = System.currentTimeMillis();

        LocalDateTime now = LocalDateTime.now(clock);
        Window month = DateWindows.currentMonth(clock);

        CompletableFuture<FinancialOverviewDTO> financial = async(() -> buildFinancial(userId, month));
        CompletableFuture<TaskOverviewDTO> tasks = async(() -> buildTaskOverview(userId));
        CompletableFuture<RecentActivityDTO> recent = async(() -> buildRecentActivity(userId, now));
        CompletableFuture<QuickStatsDTO> quickStats = async(() -> buildQuickStats(userId));
        CompletableFuture<ChartsDTO> charts = async(() -> buildCharts(userId, month));

        DashboardDTO dashboard = DashboardDTO.builder()
                .financial(await(financial))
                .tasks(await(tasks))
                .recentActivity(await(recent))
                .quickStats(await(quickStats))
                .charts(await(charts))
                .build();

        logger.info("[Dashboard] ✅ Dashboard montado em {} ms", System.currentTimeMillis() - started);
        return dashboard;
    }

    public FinancialSummaryDTO financialSummary(UUID userId) {
        Window thisMonth = DateWindows.currentMonth(clock);
        Window lastMonth = DateWindows.lastMonth(clock);

        CompletableFuture<BigDecimal> current = async(() ->
                nonNull(expenseRepository.totalsBetween(userId, thisMonth.start(), thisMonth.end()).getTotal()));
        CompletableFuture<BigDecimal> previous = async(() ->
                nonNull(expenseRepository.totalsBetween(userId, lastMonth.start(), lastMonth.end()).getTotal()));

        BigDecimal thisTotal = await(current);
        BigDecimal lastTotal = await(previous);
        BigDecimal change = ExpenseAnalyticsService.percentageChange(thisTotal, lastTotal);

        return FinancialSummaryDTO.builder()
                .thisMonth(thisTotal)
                .lastMonth(lastTotal)
                .change(change)
                .changeType(changeType(change))
                .build();
    }

    static ChangeType changeType(BigDecimal change) {
        int sign = change.signum();
        if (sign > 0) return ChangeType.INCREASE;
        if (sign < 0) return ChangeType.DECREASE;
        return ChangeType.SAME;
    }

    private FinancialOverviewDTO buildFinancial(UUID userId, Window month) {
        TotalCountProjection monthTotals = expenseRepository.totalsBetween(userId, month.start(), month.end());

        // Uma consulta por categoria com orçamento, como no caminho individual
        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        for (BudgetStatusDTO status : budgetService.perCategoryStatuses(userId)) {
            totalBudget = totalBudget.add(status.getBudget());
            totalSpent = totalSpent.add(status.getSpent());
        }
        BigDecimal budgetPercentage = BudgetStatusCalculator.percentage(totalSpent, totalBudget);

        ActiveSavingsProjection savings = savingsGoalRepository.summarizeActive(userId);
        BigDecimal totalTarget = nonNull(savings.getTotalTarget());
        BigDecimal totalCurrent = nonNull(savings.getTotalCurrent());

        List<TopCategoryDTO> topCategories = expenseRepository
                .categorySpendingBetween(userId, month.start(), month.end(), PageRequest.of(0, TOP_CATEGORIES))
                .stream()
                .map(row -> TopCategoryDTO.builder()
                        .categoryId(row.getCategoryId())
                        .categoryName(row.getCategoryName())
                        .categoryColor(row.getCategoryColor())
                        .categoryIcon(row.getCategoryIcon())
                        .totalSpent(row.getTotal())
                        .transactionCount(row.getCount() != null ? row.getCount() : 0)
                        .build())
                .toList();

        return FinancialOverviewDTO.builder()
                .totalExpensesThisMonth(nonNull(monthTotals.getTotal()))
                .expenseCountThisMonth(monthTotals.getCount() != null ? monthTotals.getCount() : 0)
                .totalBudget(totalBudget)
                .totalSpent(totalSpent)
                .budgetRemaining(totalBudget.subtract(totalSpent))
                .budgetPercentage(budgetPercentage)
                .budgetStatus(BudgetStatusCalculator.classify(budgetPercentage))
                .savings(SavingsOverviewDTO.builder()
                        .totalTarget(totalTarget)
                        .totalCurrent(totalCurrent)
                        .progress(BudgetStatusCalculator.percentage(totalCurrent, totalTarget))
                        .activeGoals(savings.getActiveGoals() != null ? savings.getActiveGoals() : 0)
                        .build())
                .topCategories(topCategories)
                .build();
    }

    private TaskOverviewDTO buildTaskOverview(UUID userId) {
        Window today = DateWindows.today(clock);

        return TaskOverviewDTO.builder()
                .dueToday(taskRepository.countDueBetween(userId, TaskStatus.ACTIVE, today.start(), today.end()))
                .overdue(taskRepository.countDueBefore(userId, TaskStatus.ACTIVE, today.start()))
                .completedThisWeek(taskRepository.countCompletedSince(userId, DateWindows.daysAgo(clock, 7)))
                .active(taskRepository.countByUserIdAndStatusIn(userId, TaskStatus.ACTIVE))
                .build();
    }

    private RecentActivityDTO buildRecentActivity(UUID userId, LocalDateTime now) {
        Pageable recent = PageRequest.of(0, RECENT_LIMIT);

        return RecentActivityDTO.builder()
                .expenses(expenseRepository.findByUserIdOrderByDateDesc(userId, recent).stream()
                        .map(ExpenseMapper::toResponseDTO)
                        .toList())
                .savings(savingsGoalRepository.findRecentContributions(userId, recent).stream()
                        .map(row -> RecentContributionDTO.builder()
                                .goalId(row.getGoalId())
                                .goalTitle(row.getGoalTitle())
                                .contributionId(row.getContributionId())
                                .amount(row.getAmount())
                                .type(row.getType())
                                .date(row.getDate())
                                .note(row.getNote())
                                .build())
                        .toList())
                .tasks(taskRepository.findByStatusOrderByNearestDue(userId, TaskStatus.ACTIVE, recent).stream()
                        .map(t -> TaskMapper.toResponseDTO(t, now))
                        .toList())
                .build();
    }

    private QuickStatsDTO buildQuickStats(UUID userId) {
        return QuickStatsDTO.builder()
                .unreadMessages(messageRepository.countUnread(userId))
                .activeShoppingLists(shoppingListRepository.countActive(userId))
                .totalNotes(noteRepository.countNotArchived(userId))
                .build();
    }

    private ChartsDTO buildCharts(UUID userId, Window month) {
        LocalDate today = LocalDate.now(clock);
        LocalDate firstDay = today.minusDays(TREND_DAYS - 1);

        Map<LocalDate, TrendPointDTO> byDay = new HashMap<>();
        for (DatedAmountProjection row : expenseRepository.findDatedAmountsSince(userId, firstDay.atStartOfDay())) {
            LocalDate day = row.getDate().toLocalDate();
            TrendPointDTO point = byDay.computeIfAbsent(day, d -> new TrendPointDTO(d, BigDecimal.ZERO, 0));
            point.setAmount(point.getAmount().add(row.getAmount()));
            point.setCount(point.getCount() + 1);
        }

        // Sempre 7 pontos, preenchendo com zero
        List<TrendPointDTO> trends = firstDay.datesUntil(today.plusDays(1))
                .map(d -> byDay.getOrDefault(d, new TrendPointDTO(d, BigDecimal.ZERO, 0)))
                .toList();

        List<CategorySpendingProjection> rows = expenseRepository
                .categorySpendingBetween(userId, month.start(), month.end(), Pageable.unpaged());
        BigDecimal monthTotal = rows.stream()
                .map(r -> nonNull(r.getTotal()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<CategorySpendingDTO> categorySpending = rows.stream()
                .map(r -> CategorySpendingDTO.builder()
                        .categoryId(r.getCategoryId())
                        .categoryName(r.getCategoryName())
                        .categoryColor(r.getCategoryColor())
                        .amount(nonNull(r.getTotal()))
                        .percentage(BudgetStatusCalculator.percentage(r.getTotal(), monthTotal))
                        .build())
                .toList();

        return ChartsDTO.builder()
                .expenseTrends(trends)
                .categorySpending(categorySpending)
                .build();
    }

    private <T> CompletableFuture<T> async(Supplier<T> block) {
        return CompletableFuture.supplyAsync(() -> readOnlyTx.execute(status -> block.get()), executor);
    }

    // Propaga a exceção original do bloco, sem o invólucro do CompletableFuture
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
