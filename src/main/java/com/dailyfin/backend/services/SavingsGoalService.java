package com.dailyfin.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dailyfin.backend.dto.savings.ContributionDTO;
import com.dailyfin.backend.dto.savings.ContributionRequestDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalRequestDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalResponseDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalUpdateDTO;
import com.dailyfin.backend.dto.savings.SavingsStatsDTO;
import com.dailyfin.backend.entities.Contribution;
import com.dailyfin.backend.entities.SavingsGoal;
import com.dailyfin.backend.enums.ContributionType;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.mappers.SavingsGoalMapper;
import com.dailyfin.backend.notifications.NotificationDispatch;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.repositories.SavingsGoalRepository;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.services.util.SavingsProgressUtils;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class SavingsGoalService {

    private static final Logger logger = LoggerFactory.getLogger(SavingsGoalService.class);

    // Prioridade alta primeiro, depois as mais recentes
    static final Comparator<SavingsGoal> LISTING_ORDER = Comparator
            .comparing(SavingsGoal::getPriority)
            .thenComparing(SavingsGoal::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final SavingsGoalRepository savingsGoalRepository;
    private final UserRepository userRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public SavingsGoalResponseDTO create(UUID userId, SavingsGoalRequestDTO dto) {
        SavingsGoal goal = SavingsGoal.builder()
                .user(userRepository.getReferenceById(userId))
                .title(dto.getTitle().trim())
                .description(dto.getDescription())
                .targetAmount(dto.getTargetAmount())
                .currentAmount(BigDecimal.ZERO)
                .targetDate(dto.getTargetDate())
                .build();

        if (dto.getIcon() != null && !dto.getIcon().isBlank()) goal.setIcon(dto.getIcon());
        if (dto.getColor() != null) goal.setColor(dto.getColor());
        if (dto.getPriority() != null) goal.setPriority(dto.getPriority());

        return SavingsGoalMapper.toResponseDTO(savingsGoalRepository.save(goal));
    }

    @Transactional(readOnly = true)
    public List<SavingsGoalResponseDTO> findAll(UUID userId, boolean includeCompleted) {
        List<SavingsGoal> goals = includeCompleted
                ? savingsGoalRepository.findByUserId(userId)
                : savingsGoalRepository.findActive(userId);

        return goals.stream()
                .sorted(LISTING_ORDER)
                .map(SavingsGoalMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public SavingsGoalResponseDTO findById(UUID userId, UUID goalId) {
        return SavingsGoalMapper.toResponseDTO(findEntity(userId, goalId));
    }

    @Transactional
    public SavingsGoalResponseDTO update(UUID userId, UUID goalId, SavingsGoalUpdateDTO dto) {
        SavingsGoal goal = findEntity(userId, goalId);

        if (goal.isCompleted()) {
            throw new BadRequestException("Não é possível alterar uma meta concluída");
        }

        if (dto.getTitle() != null) goal.setTitle(dto.getTitle().trim());
        if (dto.getDescription() != null) goal.setDescription(dto.getDescription());
        if (dto.getTargetAmount() != null) goal.setTargetAmount(dto.getTargetAmount());
        if (dto.getTargetDate() != null) goal.setTargetDate(dto.getTargetDate());
        if (dto.getIcon() != null && !dto.getIcon().isBlank()) goal.setIcon(dto.getIcon());
        if (dto.getColor() != null) goal.setColor(dto.getColor());
        if (dto.getPriority() != null) goal.setPriority(dto.getPriority());

        // Reduzir o alvo pode concluir a meta
        SavingsProgressUtils.recomputeCompletion(goal, LocalDateTime.now(clock));

        return SavingsGoalMapper.toResponseDTO(savingsGoalRepository.save(goal));
    }

    @Transactional
    public void delete(UUID userId, UUID goalId) {
        savingsGoalRepository.delete(findEntity(userId, goalId));
    }

    /**
     * Registra um depósito e notifica o menor marco (25/50/75/100) cruzado, se houver.
     */
    @Transactional
    public SavingsGoalResponseDTO addContribution(UUID userId, UUID goalId, ContributionRequestDTO dto) {
        SavingsGoal goal = findEntity(userId, goalId);
        LocalDateTime now = LocalDateTime.now(clock);

        BigDecimal oldProgress = SavingsProgressUtils.rawProgress(goal.getCurrentAmount(), goal.getTargetAmount());

        goal.getContributions().add(Contribution.builder()
                .id(UUID.randomUUID())
                .amount(dto.getAmount())
                .type(ContributionType.DEPOSIT)
                .date(now)
                .note(dto.getNote())
                .build());
        goal.setCurrentAmount(goal.getCurrentAmount().add(dto.getAmount()));
        SavingsProgressUtils.recomputeCompletion(goal, now);

        SavingsGoal saved = savingsGoalRepository.save(goal);

        BigDecimal newProgress = SavingsProgressUtils.rawProgress(saved.getCurrentAmount(), saved.getTargetAmount());
        Optional<Integer> milestone = SavingsProgressUtils.lowestCrossedMilestone(oldProgress, newProgress);
        milestone.ifPresent(m -> {
            logger.info("[Savings] 🎯 Meta {} cruzou o marco de {}%", saved.getId(), m);
            NotificationDispatch.dispatch("marco de economia",
                    () -> notificationService.sendSavingsMilestone(userId, saved.getTitle(), m));
        });

        return SavingsGoalMapper.toResponseDTO(saved);
    }

    /**
     * Retirada: reduz o saldo e pode desfazer a conclusão. Nunca dispara marcos.
     */
    @Transactional
    public SavingsGoalResponseDTO withdraw(UUID userId, UUID goalId, ContributionRequestDTO dto) {
        SavingsGoal goal = findEntity(userId, goalId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (dto.getAmount().compareTo(goal.getCurrentAmount()) > 0) {
            throw new BadRequestException("Valor da retirada maior que o saldo da meta");
        }

        goal.getContributions().add(Contribution.builder()
                .id(UUID.randomUUID())
                .amount(dto.getAmount())
                .type(ContributionType.WITHDRAWAL)
                .date(now)
                .note(dto.getNote())
                .build());
        goal.setCurrentAmount(goal.getCurrentAmount().subtract(dto.getAmount()));
        SavingsProgressUtils.recomputeCompletion(goal, now);

        return SavingsGoalMapper.toResponseDTO(savingsGoalRepository.save(goal));
    }

    @Transactional(readOnly = true)
    public List<ContributionDTO> contributions(UUID userId, UUID goalId) {
        return findEntity(userId, goalId).getContributions().stream()
                .sorted(Comparator.comparing(Contribution::getDate).reversed())
                .map(SavingsGoalMapper::toContributionDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public SavingsStatsDTO stats(UUID userId) {
        List<SavingsGoal> goals = savingsGoalRepository.findByUserId(userId);

        int completed = (int) goals.stream().filter(SavingsGoal::isCompleted).count();
        BigDecimal totalTarget = BigDecimal.ZERO;
        BigDecimal totalCurrent = BigDecimal.ZERO;
        BigDecimal totalRemaining = BigDecimal.ZERO;
        for (SavingsGoal g : goals) {
            totalTarget = totalTarget.add(g.getTargetAmount());
            totalCurrent = totalCurrent.add(g.getCurrentAmount());
            totalRemaining = totalRemaining.add(SavingsProgressUtils.remaining(g.getCurrentAmount(), g.getTargetAmount()));
        }

        return SavingsStatsDTO.builder()
                .totalGoals(goals.size())
                .completedGoals(completed)
                .activeGoals(goals.size() - completed)
                .totalTargetAmount(totalTarget)
                .totalCurrentAmount(totalCurrent)
                .totalRemainingAmount(totalRemaining)
                .overallProgress(SavingsProgressUtils.rawProgress(totalCurrent, totalTarget)
                        .setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private SavingsGoal findEntity(UUID userId, UUID goalId) {
        return savingsGoalRepository.findByIdAndUserId(goalId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Meta de economia não encontrada"));
    }
}
