package com.dailyfin.backend.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.category.CategoryDeletionCheckDTO;
import com.dailyfin.backend.dto.category.CategoryDeletionResultDTO;
import com.dailyfin.backend.dto.category.CategoryRequestDTO;
import com.dailyfin.backend.dto.category.CategoryResponseDTO;
import com.dailyfin.backend.dto.category.CategoryUpdateDTO;
import com.dailyfin.backend.dto.category.ReorderCategoriesRequestDTO;
import com.dailyfin.backend.entities.Category;
import com.dailyfin.backend.entities.User;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ConflictException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.CategoryMapper;
import com.dailyfin.backend.repositories.CategoryRepository;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    record DefaultCategory(String name, String icon, String color) {
    }

    static final List<DefaultCategory> DEFAULT_CATEGORIES = List.of(
            new DefaultCategory("Food & Dining", "restaurant", "#FF6B6B"),
            new DefaultCategory("Transport", "directions-car", "#4ECDC4"),
            new DefaultCategory("Shopping", "shopping-bag", "#95E1D3"),
            new DefaultCategory("Entertainment", "movie", "#F38181"),
            new DefaultCategory("Healthcare", "local-hospital", "#AA96DA"),
            new DefaultCategory("Education", "school", "#FCBAD3"),
            new DefaultCategory("Utilities", "lightbulb", "#FDDB3A"),
            new DefaultCategory("Others", "category", "#6C5CE7")
    );

    private final CategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;
    private final UserRepository userRepository;

    public void createDefaultCategories(User user) {
        List<Category> defaults = new ArrayList<>();
        for (int i = 0; i < DEFAULT_CATEGORIES.size(); i++) {
            DefaultCategory def = DEFAULT_CATEGORIES.get(i);
            defaults.add(Category.builder()
                    .user(user)
                    .name(def.name())
                    .icon(def.icon())
                    .color(def.color())
                    .displayOrder(i + 1)
                    .isDefault(true)
                    .build());
        }
        categoryRepository.saveAll(defaults);
    }

    @Transactional
    public CategoryResponseDTO create(UUID userId, CategoryRequestDTO dto) {
        String name = dto.getName().trim();
        if (categoryRepository.existsByUserIdAndNameIgnoreCase(userId, name)) {
            throw new ConflictException("Já existe uma categoria com este nome");
        }

        Category category = Category.builder()
                .user(userRepository.getReferenceById(userId))
                .name(name)
                .monthlyBudget(dto.getMonthlyBudget())
                .displayOrder(categoryRepository.findMaxDisplayOrder(userId) + 1)
                .isDefault(false)
                .build();
        if (dto.getIcon() != null && !dto.getIcon().isBlank()) {
            category.setIcon(dto.getIcon());
        }
        if (dto.getColor() != null) {
            category.setColor(dto.getColor());
        }

        return CategoryMapper.toResponseDTO(categoryRepository.save(category));
    }

    public List<CategoryResponseDTO> findAll(UUID userId) {
        return categoryRepository.findAllOrdered(userId).stream()
                .map(CategoryMapper::toResponseDTO)
                .toList();
    }

    public CategoryResponseDTO findById(UUID userId, UUID categoryId) {
        return CategoryMapper.toResponseDTO(findEntity(userId, categoryId));
    }

    @Transactional
    public CategoryResponseDTO update(UUID userId, UUID categoryId, CategoryUpdateDTO dto) {
        Category category = findEntity(userId, categoryId);

        if (dto.getName() != null && !dto.getName().trim().equals(category.getName())) {
            String name = dto.getName().trim();
            if (categoryRepository.existsByUserIdAndNameIgnoreCaseAndIdNot(userId, name, categoryId)) {
                throw new ConflictException("Já existe uma categoria com este nome");
            }
            category.setName(name);
        }
        if (dto.getIcon() != null && !dto.getIcon().isBlank()) category.setIcon(dto.getIcon());
        if (dto.getColor() != null) category.setColor(dto.getColor());
        if (dto.getMonthlyBudget() != null) category.setMonthlyBudget(dto.getMonthlyBudget());
        if (dto.getOrder() != null) category.setDisplayOrder(dto.getOrder());

        return CategoryMapper.toResponseDTO(categoryRepository.save(category));
    }

    public CategoryDeletionCheckDTO checkDeletion(UUID userId, UUID categoryId) {
        findEntity(userId, categoryId);
        long expenseCount = expenseRepository.countByUserIdAndCategoryId(userId, categoryId);

        if (expenseCount > 0) {
            return new CategoryDeletionCheckDTO(
                    false,
                    expenseCount,
                    "Esta categoria possui " + expenseCount
                            + " despesa(s). Excluí-la também removerá essas despesas.",
                    true
            );
        }
        return new CategoryDeletionCheckDTO(true, 0, "A categoria pode ser excluída com segurança.", false);
    }

    /**
     * Remove a categoria. Havendo despesas, exige confirmação e as remove junto.
     */
    @Transactional
    public CategoryDeletionResultDTO delete(UUID userId, UUID categoryId, boolean confirmed) {
        Category category = findEntity(userId, categoryId);
        long expenseCount = expenseRepository.countByUserIdAndCategoryId(userId, categoryId);

        if (expenseCount > 0 && !confirmed) {
            throw new BadRequestException("A categoria possui " + expenseCount
                    + " despesa(s). Confirme a exclusão para continuar.");
        }

        long deleted = 0;
        if (expenseCount > 0) {
            deleted = expenseRepository.deleteByUserIdAndCategoryId(userId, categoryId);
        }
        categoryRepository.delete(category);

        log.info("[Category] Categoria {} removida com {} despesa(s)", categoryId, deleted);
        return new CategoryDeletionResultDTO(deleted);
    }

    private Category findEntity(UUID userId, UUID categoryId) {
        return categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Categoria não encontrada"));
    }

    // Ids desconhecidos ou de outro usuário são ignorados
    @Transactional
    public void reorder(UUID userId, ReorderCategoriesRequestDTO dto) {
        List<UUID> ids = dto.getCategories().stream()
                .map(ReorderCategoriesRequestDTO.Item::getId)
                .toList();

        Map<UUID, Category> owned = categoryRepository.findByUserIdAndIdIn(userId, ids).stream()
                .collect(Collectors.toMap(Category::getId, Function.identity()));

        for (ReorderCategoriesRequestDTO.Item item : dto.getCategories()) {
            Category category = owned.get(item.getId());
            if (category != null && item.getOrder() != null) {
                category.setDisplayOrder(item.getOrder());
            }
        }
        categoryRepository.saveAll(owned.values());
    }
}
