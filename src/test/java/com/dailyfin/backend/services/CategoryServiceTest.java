package com.dailyfin.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

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
import com.dailyfin.backend.repositories.CategoryRepository;
import com.dailyfin.backend.repositories.ExpenseRepository;
import com.dailyfin.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private CategoryService categoryService;

    private final UUID userId = UUID.randomUUID();

    @Test
    @SuppressWarnings("unchecked")
    void createDefaultCategories_savesEightOrderedDefaults() {
        User user = new User();
        user.setId(userId);

        categoryService.createDefaultCategories(user);

        ArgumentCaptor<List<Category>> captor = ArgumentCaptor.forClass(List.class);
        verify(categoryRepository).saveAll(captor.capture());
        List<Category> saved = captor.getValue();

        assertEquals(8, saved.size());
        assertEquals("Food & Dining", saved.get(0).getName());
        assertEquals(1, saved.get(0).getDisplayOrder());
        assertEquals("Others", saved.get(7).getName());
        assertEquals(8, saved.get(7).getDisplayOrder());
        assertTrue(saved.stream().allMatch(Category::isDefault));
    }

    @Test
    void create_appendsAfterHighestOrder() {
        User user = new User();
        user.setId(userId);
        when(categoryRepository.existsByUserIdAndNameIgnoreCase(userId, "Pets")).thenReturn(false);
        when(userRepository.getReferenceById(userId)).thenReturn(user);
        when(categoryRepository.findMaxDisplayOrder(userId)).thenReturn(8);
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        CategoryRequestDTO dto = new CategoryRequestDTO();
        dto.setName(" Pets ");
        dto.setMonthlyBudget(new BigDecimal("150"));

        CategoryResponseDTO response = categoryService.create(userId, dto);

        assertEquals("Pets", response.getName());
        assertEquals(9, response.getOrder());
        assertFalse(response.getIsDefault());
        assertEquals("category", response.getIcon());
    }

    @Test
    void create_duplicateName_throwsConflict() {
        when(categoryRepository.existsByUserIdAndNameIgnoreCase(userId, "Transport")).thenReturn(true);

        CategoryRequestDTO dto = new CategoryRequestDTO();
        dto.setName("Transport");

        assertThrows(ConflictException.class, () -> categoryService.create(userId, dto));
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void update_renameToExistingName_throwsConflict() {
        Category category = category("Shopping");
        when(categoryRepository.findByIdAndUserId(category.getId(), userId)).thenReturn(Optional.of(category));
        when(categoryRepository.existsByUserIdAndNameIgnoreCaseAndIdNot(userId, "Utilities", category.getId()))
                .thenReturn(true);

        CategoryUpdateDTO dto = new CategoryUpdateDTO();
        dto.setName("Utilities");

        assertThrows(ConflictException.class, () -> categoryService.update(userId, category.getId(), dto));
    }

    @Test
    void checkDeletion_withExpenses_requiresConfirmation() {
        Category category = category("Food & Dining");
        when(categoryRepository.findByIdAndUserId(category.getId(), userId)).thenReturn(Optional.of(category));
        when(expenseRepository.countByUserIdAndCategoryId(userId, category.getId())).thenReturn(4L);

        CategoryDeletionCheckDTO check = categoryService.checkDeletion(userId, category.getId());

        assertFalse(check.isCanDelete());
        assertTrue(check.isRequiresConfirmation());
        assertEquals(4, check.getExpenseCount());
    }

    @Test
    void delete_withExpensesNotConfirmed_throwsBadRequest() {
        Category category = category("Food & Dining");
        when(categoryRepository.findByIdAndUserId(category.getId(), userId)).thenReturn(Optional.of(category));
        when(expenseRepository.countByUserIdAndCategoryId(userId, category.getId())).thenReturn(2L);

        assertThrows(BadRequestException.class, () -> categoryService.delete(userId, category.getId(), false));
        verify(categoryRepository, never()).delete(any());
        verify(expenseRepository, never()).deleteByUserIdAndCategoryId(any(), any());
    }

    @Test
    void delete_confirmed_cascadesExpenses() {
        Category category = category("Food & Dining");
        when(categoryRepository.findByIdAndUserId(category.getId(), userId)).thenReturn(Optional.of(category));
        when(expenseRepository.countByUserIdAndCategoryId(userId, category.getId())).thenReturn(2L);
        when(expenseRepository.deleteByUserIdAndCategoryId(userId, category.getId())).thenReturn(2L);

        CategoryDeletionResultDTO result = categoryService.delete(userId, category.getId(), true);

        assertEquals(2, result.getDeletedExpenses());
        verify(categoryRepository).delete(category);
    }

    @Test
    void reorder_ignoresCategoriesOfOtherUsers() {
        Category mine = category("Shopping");
        UUID foreignId = UUID.randomUUID();

        ReorderCategoriesRequestDTO dto = new ReorderCategoriesRequestDTO();
        dto.setCategories(new ArrayList<>(List.of(
                new ReorderCategoriesRequestDTO.Item(mine.getId(), 5),
                new ReorderCategoriesRequestDTO.Item(foreignId, 1)
        )));
        when(categoryRepository.findByUserIdAndIdIn(userId, List.of(mine.getId(), foreignId)))
                .thenReturn(List.of(mine));

        categoryService.reorder(userId, dto);

        assertEquals(5, mine.getDisplayOrder());
    }

    private Category category(String name) {
        return Category.builder()
                .id(UUID.randomUUID())
                .name(name)
                .displayOrder(3)
                .build();
    }
}
