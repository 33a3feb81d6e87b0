package com.dailyfin.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.budget.BudgetStatusDTO;
import com.dailyfin.backend.dto.budget.BudgetSummaryDTO;
import com.dailyfin.backend.dto.category.CategoryResponseDTO;
import com.dailyfin.backend.entities.Category;
import com.dailyfin.backend.enums.BudgetStatusLevel;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.CategoryMapper;
import com.dailyfin.backend.notifications.NotificationDispatch;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.repositories.CategoryRepository;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseRepository.CategoryTotalProjection;
import com.dailyfin.backend.services.util.BudgetStatusCalculator;
import com.dailyfin.backend.services.util.DateWindows;
import com.dailyfin.backend.services.util.DateWindows.Window;

import lombok.RequiredArgsConstructor;

/**
 * Situação do orçamento mensal por categoria, sempre na janela do mês corrente.
 */
@Service
@RequiredArgsConstructor
public class BudgetService {

    private static final Logger logger = LoggerFactory.getLogger(BudgetService.class);

    private final CategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Status de uma categoria. Dispara alerta a cada leitura com consumo >= 80%
     * (gatilho por nível, não por transição).
     */
    @Transactional(readOnly = true)
    public BudgetStatusDTO categoryBudgetStatus(UUID userId, UUID categoryId) {
        Category category = categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Categoria não encontrada"));

        if (category.getMonthlyBudget() == null) {
            throw new ResourceNotFoundException("Orçamento não definido para esta categoria");
        }

        Window month = DateWindows.currentMonth(clock);
        BigDecimal spent = expenseRepository.sumForCategoryBetween(userId, categoryId, month.start(), month.end());

        BudgetStatusDTO status = toStatus(category, spent);

        if (BudgetStatusCalculator.shouldAlert(status.getPercentage())) {
            logger.info("[Budget] ⚠️ Categoria {} em {}% do orçamento", category.getName(), status.getPercentage());
            NotificationDispatch.dispatch("alerta de orçamento",
                    () -> notificationService.sendBudgetAlert(userId, category.getName(), status.getPercentage()));
        }

        return status;
    }

    /**
     * Resumo de todas as categorias com orçamento > 0, com uma única consulta agrupada.
     */
    @Transactional(readOnly = true)
    public BudgetSummaryDTO budgetSummary(UUID userId) {
        List<Category> categories = categoryRepository.findWithPositiveBudget(userId);
        if (categories.isEmpty()) {
            return BudgetSummaryDTO.empty();
        }

        Window month = DateWindows.currentMonth(clock);
        logger.debug("[Budget] Janela {} a {} para {} categoria(s)", month.start(), month.end(), categories.size());

        List<UUID> ids = categories.stream().map(Category::getId).toList();
        Map<UUID, BigDecimal> spentByCategory = expenseRepository
                .sumByCategoriesBetween(userId, ids, month.start(), month.end())
                .stream()
                .collect(Collectors.toMap(CategoryTotalProjection::getCategoryId, CategoryTotalProjection::getTotal));

        List<BudgetStatusDTO> statuses = new ArrayList<>();
        for (Category category : categories) {
            statuses.add(toStatus(category, spentByCategory.getOrDefault(category.getId(), BigDecimal.ZERO)));
        }
        statuses.sort(Comparator.comparing(BudgetStatusDTO::getPercentage).reversed());

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        int overBudget = 0;
        for (BudgetStatusDTO s : statuses) {
            totalBudget = totalBudget.add(s.getBudget());
            totalSpent = totalSpent.add(s.getSpent());
            if (s.getStatus() == BudgetStatusLevel.EXCEEDED) {
                overBudget++;
            }
        }

        return BudgetSummaryDTO.builder()
                .totalBudget(totalBudget)
                .totalSpent(totalSpent)
                .totalRemaining(totalBudget.subtract(totalSpent))
                .overallPercentage(BudgetStatusCalculator.percentage(totalSpent, totalBudget))
                .categoriesWithBudget(statuses.size())
                .categoriesOverBudget(overBudget)
                .categories(statuses)
                .build();
    }

    public List<BudgetStatusDTO> budgetAlerts(UUID userId) {
        return budgetSummary(userId).getCategories().stream()
                .filter(s -> s.getStatus() != BudgetStatusLevel.SAFE)
                .toList();
    }

    /**
     * Define ou remove (null) o orçamento mensal da categoria.
     */
    @Transactional
    public CategoryResponseDTO updateCategoryBudget(UUID userId, UUID categoryId, BigDecimal budget) {
        Category category = categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Categoria não encontrada"));
        category.setMonthlyBudget(budget);
        logger.info("[Budget] Orçamento da categoria {} atualizado para {}", categoryId, budget);
        return CategoryMapper.toResponseDTO(categoryRepository.save(category));
    }

    /**
     * Caminho por categoria (uma consulta por categoria com orçamento definido),
     * usado pelo dashboard.
     */
    @Transactional(readOnly = true)
    public List<BudgetStatusDTO> perCategoryStatuses(UUID userId) {
        Window month = DateWindows.currentMonth(clock);
        List<BudgetStatusDTO> statuses = new ArrayList<>();
        for (Category category : categoryRepository.findWithBudgetDefined(userId)) {
            BigDecimal spent = expenseRepository.sumForCategoryBetween(
                    userId, category.getId(), month.start(), month.end());
            statuses.add(toStatus(category, spent));
        }
        return statuses;
    }

    private BudgetStatusDTO toStatus(Category category, BigDecimal spent) {
        BigDecimal budget = category.getMonthlyBudget();
        BigDecimal safeSpent = spent != null ? spent : BigDecimal.ZERO;
        BigDecimal percentage = BudgetStatusCalculator.percentage(safeSpent, budget);
        BudgetStatusLevel level = BudgetStatusCalculator.classify(percentage);

        return BudgetStatusDTO.builder()
                .categoryId(category.getId())
                .categoryName(category.getName())
                .categoryColor(category.getColor())
                .categoryIcon(category.getIcon())
                .budget(budget)
                .spent(safeSpent)
                .remaining(budget.subtract(safeSpent))
                .percentage(percentage)
                .status(level)
                .color(level.getColor())
                .build();
    }
}
