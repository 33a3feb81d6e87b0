package com.dailyfin.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.PaginatedResponse;
import com.dailyfin.backend.dto.expense.ExpenseFilter;
import com.dailyfin.backend.dto.expense.ExpenseRequestDTO;
import com.dailyfin.backend.dto.expense.ExpenseResponseDTO;
import com.dailyfin.backend.dto.expense.ExpenseUpdateDTO;
import com.dailyfin.backend.entities.Category;
import com.dailyfin.backend.entities.Expense;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.ExpenseMapper;
import com.dailyfin.backend.repositories.CategoryRepository;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.ExpenseSpecifications;
import com.dailyfin.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ExpenseService {

    private static final Logger logger = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseRepository expenseRepository;
    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public ExpenseResponseDTO create(UUID userId, ExpenseRequestDTO dto) {
        Category category = ownedCategory(userId, dto.getCategoryId());

        Expense expense = Expense.builder()
                .user(userRepository.getReferenceById(userId))
                .category(category)
                .amount(dto.getAmount())
                .description(dto.getDescription())
                .date(dto.getDate() != null ? dto.getDate() : LocalDateTime.now(clock))
                .receiptImage(dto.getReceiptImage())
                .location(ExpenseMapper.toLocation(dto.getLocation()))
                .isRecurring(Boolean.TRUE.equals(dto.getIsRecurring()))
                .recurringConfig(ExpenseMapper.toRecurringConfig(dto.getRecurringConfig()))
                .build();

        if (dto.getPaymentMethod() != null) {
            expense.setPaymentMethod(dto.getPaymentMethod());
        }
        if (dto.getTags() != null) {
            expense.setTags(new LinkedHashSet<>(dto.getTags()));
        }

        Expense saved = expenseRepository.save(expense);
        logger.debug("[Expense] Despesa {} criada na categoria {}", saved.getId(), category.getId());
        return ExpenseMapper.toResponseDTO(saved);
    }

    @Transactional(readOnly = true)
    public ExpenseResponseDTO findById(UUID userId, UUID expenseId) {
        return ExpenseMapper.toResponseDTO(findEntity(userId, expenseId));
    }

    @Transactional
    public ExpenseResponseDTO update(UUID userId, UUID expenseId, ExpenseUpdateDTO dto) {
        Expense expense = findEntity(userId, expenseId);

        if (dto.getCategoryId() != null && !dto.getCategoryId().equals(expense.getCategory().getId())) {
            expense.setCategory(ownedCategory(userId, dto.getCategoryId()));
        }
        if (dto.getAmount() != null) expense.setAmount(dto.getAmount());
        if (dto.getDescription() != null) expense.setDescription(dto.getDescription());
        if (dto.getDate() != null) expense.setDate(dto.getDate());
        if (dto.getPaymentMethod() != null) expense.setPaymentMethod(dto.getPaymentMethod());
        if (dto.getTags() != null) expense.setTags(new LinkedHashSet<>(dto.getTags()));
        if (dto.getReceiptImage() != null) expense.setReceiptImage(dto.getReceiptImage());
        if (dto.getLocation() != null) expense.setLocation(ExpenseMapper.toLocation(dto.getLocation()));
        if (dto.getIsRecurring() != null) expense.setRecurring(dto.getIsRecurring());
        if (dto.getRecurringConfig() != null) {
            expense.setRecurringConfig(ExpenseMapper.toRecurringConfig(dto.getRecurringConfig()));
        }

        return ExpenseMapper.toResponseDTO(expenseRepository.save(expense));
    }

    @Transactional
    public void delete(UUID userId, UUID expenseId) {
        Expense expense = findEntity(userId, expenseId);
        expenseRepository.delete(expense);
    }

    /**
     * Listagem paginada. Filtros combinados com AND; página 1-indexada.
     */
    @Transactional(readOnly = true)
    public PaginatedResponse<ExpenseResponseDTO> list(UUID userId, ExpenseFilter filter) {
        int page = Math.max(filter.getPage(), 1);
        int limit = Math.min(Math.max(filter.getLimit(), 1), ExpenseFilter.MAX_LIMIT);

        Specification<Expense> spec = Specification.where(ExpenseSpecifications.ownedBy(userId))
                .and(ExpenseSpecifications.inCategory(filter.getCategoryId()))
                .and(ExpenseSpecifications.dateFrom(filter.getStartDate()))
                .and(ExpenseSpecifications.dateUntil(filter.getEndDate()))
                .and(ExpenseSpecifications.amountAtLeast(filter.getMinAmount()))
                .and(ExpenseSpecifications.amountAtMost(filter.getMaxAmount()))
                .and(ExpenseSpecifications.paidWith(filter.getPaymentMethod()))
                .and(ExpenseSpecifications.taggedWithAny(filter.getTags()));

        Sort.Direction direction = filter.isAscending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(direction, filter.getSortBy().property());

        Page<Expense> result = expenseRepository.findAll(spec, PageRequest.of(page - 1, limit, sort));

        List<ExpenseResponseDTO> data = result.getContent().stream()
                .map(ExpenseMapper::toResponseDTO)
                .toList();

        return PaginatedResponse.of(data, page, limit, result.getTotalElements());
    }

    private Expense findEntity(UUID userId, UUID expenseId) {
        return expenseRepository.findByIdAndUserId(expenseId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Despesa não encontrada"));
    }

    // Categoria de outro usuário é tratada como inexistente
    private Category ownedCategory(UUID userId, UUID categoryId) {
        return categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Categoria não encontrada"));
    }
}
