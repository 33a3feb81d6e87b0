package com.dailyfin.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.shopping.ShoppingItemRequestDTO;
import com.dailyfin.backend.dto.shopping.ShoppingItemUpdateDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListRequestDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListResponseDTO;
import com.dailyfin.backend.dto.shopping.ShoppingListUpdateDTO;
import com.dailyfin.backend.dto.shopping.ShoppingStatsDTO;
import com.dailyfin.backend.entities.ShoppingItem;
import com.dailyfin.backend.entities.ShoppingList;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.ShoppingListMapper;
import com.dailyfin.backend.repositories.ShoppingListRepository;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.services.util.ShoppingListRules;

import lombok.RequiredArgsConstructor;

/**
 * Listas de compras ("bazar"). Toda mutação reaplica as regras de compra e conclusão.
 */
@Service
@RequiredArgsConstructor
public class ShoppingListService {

    static final String DEFAULT_ITEM_CATEGORY = "Other";
    static final String DEFAULT_UNIT = "pcs";

    private final ShoppingListRepository shoppingListRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public ShoppingListResponseDTO create(UUID userId, ShoppingListRequestDTO dto) {
        ShoppingList list = ShoppingList.builder()
                .user(userRepository.getReferenceById(userId))
                .title(dto.getTitle().trim())
                .description(dto.getDescription())
                .totalBudget(dto.getTotalBudget())
                .build();

        return ShoppingListMapper.toResponseDTO(shoppingListRepository.save(list));
    }

    @Transactional(readOnly = true)
    public List<ShoppingListResponseDTO> findAll(UUID userId, Boolean completed, String search) {
        String term = search == null || search.isBlank() ? null : search.trim();
        return shoppingListRepository.search(userId, completed, term).stream()
                .map(ShoppingListMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public ShoppingListResponseDTO findById(UUID userId, UUID listId) {
        return ShoppingListMapper.toResponseDTO(findEntity(userId, listId));
    }

    @Transactional
    public ShoppingListResponseDTO update(UUID userId, UUID listId, ShoppingListUpdateDTO dto) {
        ShoppingList list = findEntity(userId, listId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (dto.getTitle() != null) list.setTitle(dto.getTitle().trim());
        if (dto.getDescription() != null) list.setDescription(dto.getDescription());
        if (dto.getTotalBudget() != null) list.setTotalBudget(dto.getTotalBudget());
        // Só tem efeito em listas vazias; com itens, vale o estado das compras
        if (dto.getIsCompleted() != null && dto.getIsCompleted() != list.isCompleted()) {
            list.setCompleted(dto.getIsCompleted());
            list.setCompletedAt(dto.getIsCompleted() ? now : null);
        }

        return save(list, now);
    }

    @Transactional
    public void delete(UUID userId, UUID listId) {
        shoppingListRepository.delete(findEntity(userId, listId));
    }

    @Transactional
    public ShoppingListResponseDTO addItem(UUID userId, UUID listId, ShoppingItemRequestDTO dto) {
        ShoppingList list = findEntity(userId, listId);

        list.getItems().add(ShoppingItem.builder()
                .id(UUID.randomUUID())
                .name(dto.getName().trim())
                .category(isBlank(dto.getCategory()) ? DEFAULT_ITEM_CATEGORY : dto.getCategory())
                .quantity(dto.getQuantity())
                .unit(isBlank(dto.getUnit()) ? DEFAULT_UNIT : dto.getUnit())
                .estimatedPrice(dto.getEstimatedPrice())
                .isPurchased(false)
                .notes(dto.getNotes())
                .build());

        return save(list, LocalDateTime.now(clock));
    }

    @Transactional
    public ShoppingListResponseDTO updateItem(UUID userId, UUID listId, UUID itemId, ShoppingItemUpdateDTO dto) {
        ShoppingList list = findEntity(userId, listId);
        ShoppingItem item = findItem(list, itemId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (dto.getName() != null) item.setName(dto.getName().trim());
        if (dto.getCategory() != null) item.setCategory(dto.getCategory());
        if (dto.getQuantity() != null) item.setQuantity(dto.getQuantity());
        if (dto.getUnit() != null) item.setUnit(dto.getUnit());
        if (dto.getEstimatedPrice() != null) item.setEstimatedPrice(dto.getEstimatedPrice());
        if (dto.getActualPrice() != null) item.setActualPrice(dto.getActualPrice());
        if (dto.getNotes() != null) item.setNotes(dto.getNotes());
        if (dto.getIsPurchased() != null) ShoppingListRules.applyPurchase(item, dto.getIsPurchased(), now);

        return save(list, now);
    }

    @Transactional
    public ShoppingListResponseDTO deleteItem(UUID userId, UUID listId, UUID itemId) {
        ShoppingList list = findEntity(userId, listId);
        ShoppingItem item = findItem(list, itemId);
        list.getItems().remove(item);
        return save(list, LocalDateTime.now(clock));
    }

    @Transactional
    public ShoppingListResponseDTO toggleItemPurchase(UUID userId, UUID listId, UUID itemId) {
        ShoppingList list = findEntity(userId, listId);
        ShoppingItem item = findItem(list, itemId);
        LocalDateTime now = LocalDateTime.now(clock);
        ShoppingListRules.applyPurchase(item, !item.isPurchased(), now);
        return save(list, now);
    }

    @Transactional(readOnly = true)
    public ShoppingStatsDTO stats(UUID userId) {
        List<ShoppingList> lists = shoppingListRepository.findByUserId(userId);

        int completed = 0;
        int totalItems = 0;
        int purchasedItems = 0;
        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;

        for (ShoppingList list : lists) {
            if (list.isCompleted()) completed++;
            totalItems += list.getItems().size();
            purchasedItems += ShoppingListRules.completedItems(list);
            if (list.getTotalBudget() != null) totalBudget = totalBudget.add(list.getTotalBudget());
            totalSpent = totalSpent.add(ShoppingListRules.totalActualCost(list));
        }

        return ShoppingStatsDTO.builder()
                .totalLists(lists.size())
                .activeLists(lists.size() - completed)
                .completedLists(completed)
                .totalItems(totalItems)
                .purchasedItems(purchasedItems)
                .totalBudget(totalBudget)
                .totalSpent(totalSpent)
                .build();
    }

    private ShoppingListResponseDTO save(ShoppingList list, LocalDateTime now) {
        ShoppingListRules.recomputeCompletion(list, now);
        return ShoppingListMapper.toResponseDTO(shoppingListRepository.save(list));
    }

    private ShoppingList findEntity(UUID userId, UUID listId) {
        return shoppingListRepository.findByIdAndUserId(listId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Lista de compras não encontrada"));
    }

    private static ShoppingItem findItem(ShoppingList list, UUID itemId) {
        return list.getItems().stream()
                .filter(i -> i.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Item não encontrado"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
