package com.dailyfin.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dailyfin.backend.dto.savings.ContributionDTO;
import com.dailyfin.backend.dto.savings.ContributionRequestDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalResponseDTO;
import com.dailyfin.backend.dto.savings.SavingsGoalUpdateDTO;
import com.dailyfin.backend.dto.savings.SavingsStatsDTO;
import com.dailyfin.backend.entities.Contribution;
import com.dailyfin.backend.entities.SavingsGoal;
import com.dailyfin.backend.enums.ContributionType;
import com.dailyfin.backend.enums.GoalPriority;
import com.dailyfin.backend.exceptions.BadRequestException;
import com.dailyfin.backend.exceptions.ResourceNotFoundException;
import com.dailyfin.backend.notifications.NotificationService;
import com.dailyfin.backend.repositories.SavingsGoalRepository;
import com.dailyfin.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class SavingsGoalServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-10T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SavingsGoalRepository savingsGoalRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationService notificationService;

    private SavingsGoalService savingsGoalService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        savingsGoalService = new SavingsGoalService(savingsGoalRepository, userRepository, notificationService, CLOCK);
    }

    @Test
    void addContribution_crossingSeveralMilestones_notifiesLowestOnly() {
        SavingsGoal goal = goal("Viagem", "1000", "200");
        stubFind(goal);
        when(savingsGoalRepository.save(any(SavingsGoal.class))).thenAnswer(inv -> inv.getArgument(0));

        SavingsGoalResponseDTO response = savingsGoalService.addContribution(userId, goal.getId(),
                new ContributionRequestDTO(new BigDecimal("400"), "bônus"));

        assertEquals(new BigDecimal("600"), response.getCurrentAmount());
        assertEquals(new BigDecimal("60.00"), response.getProgress());
        assertEquals(1, goal.getContributions().size());
        assertEquals(ContributionType.DEPOSIT, goal.getContributions().get(0).getType());
        verify(notificationService).sendSavingsMilestone(userId, "Viagem", 25);
    }

    @Test
    void addContribution_reachingTarget_completesGoal() {
        SavingsGoal goal = goal("Reserva", "500", "450");
        stubFind(goal);
        when(savingsGoalRepository.save(any(SavingsGoal.class))).thenAnswer(inv -> inv.getArgument(0));

        SavingsGoalResponseDTO response = savingsGoalService.addContribution(userId, goal.getId(),
                new ContributionRequestDTO(new BigDecimal("80"), null));

        assertTrue(response.getIsCompleted());
        assertEquals(LocalDateTime.of(2024, 6, 10, 12, 0), goal.getCompletedAt());
        assertEquals(new BigDecimal("100.00"), response.getProgress());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getRemainingAmount()));
        verify(notificationService).sendSavingsMilestone(userId, "Reserva", 100);
    }

    @Test
    void addContribution_withinSameBand_doesNotNotify() {
        SavingsGoal goal = goal("Carro", "1000", "300");
        stubFind(goal);
        when(savingsGoalRepository.save(any(SavingsGoal.class))).thenAnswer(inv -> inv.getArgument(0));

        savingsGoalService.addContribution(userId, goal.getId(), new ContributionRequestDTO(new BigDecimal("100"), null));

        verify(notificationService, never()).sendSavingsMilestone(any(), any(), anyInt());
    }

    @Test
    void withdraw_belowTarget_uncompletesGoalWithoutMilestone() {
        SavingsGoal goal = goal("Reserva", "500", "500");
        goal.setCompleted(true);
        goal.setCompletedAt(LocalDateTime.of(2024, 5, 1, 9, 0));
        stubFind(goal);
        when(savingsGoalRepository.save(any(SavingsGoal.class))).thenAnswer(inv -> inv.getArgument(0));

        SavingsGoalResponseDTO response = savingsGoalService.withdraw(userId, goal.getId(),
                new ContributionRequestDTO(new BigDecimal("100"), "emergência"));

        assertFalse(response.getIsCompleted());
        assertNull(goal.getCompletedAt());
        assertEquals(new BigDecimal("400"), goal.getCurrentAmount());
        assertEquals(ContributionType.WITHDRAWAL, goal.getContributions().get(0).getType());
        verify(notificationService, never()).sendSavingsMilestone(any(), any(), anyInt());
    }

    @Test
    void withdraw_moreThanBalance_throwsBadRequest() {
        SavingsGoal goal = goal("Reserva", "500", "50");
        stubFind(goal);

        assertThrows(BadRequestException.class, () -> savingsGoalService.withdraw(userId, goal.getId(),
                new ContributionRequestDTO(new BigDecimal("50.01"), null)));
        verify(savingsGoalRepository, never()).save(any());
    }

    @Test
    void update_completedGoal_isRejected() {
        SavingsGoal goal = goal("Reserva", "500", "500");
        goal.setCompleted(true);
        stubFind(goal);

        SavingsGoalUpdateDTO dto = new SavingsGoalUpdateDTO();
        dto.setTitle("Nova reserva");

        assertThrows(BadRequestException.class, () -> savingsGoalService.update(userId, goal.getId(), dto));
    }

    @Test
    void update_loweringTarget_canCompleteGoal() {
        SavingsGoal goal = goal("Notebook", "5000", "3000");
        stubFind(goal);
        when(savingsGoalRepository.save(any(SavingsGoal.class))).thenAnswer(inv -> inv.getArgument(0));

        SavingsGoalUpdateDTO dto = new SavingsGoalUpdateDTO();
        dto.setTargetAmount(new BigDecimal("3000"));

        SavingsGoalResponseDTO response = savingsGoalService.update(userId, goal.getId(), dto);

        assertTrue(response.getIsCompleted());
        assertNotNull(goal.getCompletedAt());
    }

    @Test
    void findAll_ordersByPriorityThenNewest() {
        SavingsGoal lowOld = goal("Low", "100", "0");
        lowOld.setPriority(GoalPriority.LOW);
        lowOld.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        SavingsGoal highOld = goal("High old", "100", "0");
        highOld.setPriority(GoalPriority.HIGH);
        highOld.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        SavingsGoal highNew = goal("High new", "100", "0");
        highNew.setPriority(GoalPriority.HIGH);
        highNew.setCreatedAt(LocalDateTime.of(2024, 5, 1, 0, 0));
        SavingsGoal medium = goal("Medium", "100", "0");
        medium.setCreatedAt(LocalDateTime.of(2024, 3, 1, 0, 0));

        when(savingsGoalRepository.findActive(userId)).thenReturn(List.of(lowOld, medium, highOld, highNew));

        List<String> titles = savingsGoalService.findAll(userId, false).stream()
                .map(SavingsGoalResponseDTO::getTitle)
                .toList();

        assertEquals(List.of("High new", "High old", "Medium", "Low"), titles);
    }

    @Test
    void contributions_newestFirst() {
        SavingsGoal goal = goal("Viagem", "1000", "300");
        goal.getContributions().add(contribution("100", LocalDateTime.of(2024, 1, 10, 0, 0)));
        goal.getContributions().add(contribution("200", LocalDateTime.of(2024, 4, 2, 0, 0)));
        stubFind(goal);

        List<ContributionDTO> history = savingsGoalService.contributions(userId, goal.getId());

        assertEquals(new BigDecimal("200"), history.get(0).getAmount());
        assertEquals(new BigDecimal("100"), history.get(1).getAmount());
    }

    @Test
    void stats_remainingNeverNegativePerGoal() {
        SavingsGoal over = goal("Over", "100", "150");
        over.setCompleted(true);
        SavingsGoal half = goal("Half", "400", "200");
        when(savingsGoalRepository.findByUserId(userId)).thenReturn(List.of(over, half));

        SavingsStatsDTO stats = savingsGoalService.stats(userId);

        assertEquals(2, stats.getTotalGoals());
        assertEquals(1, stats.getCompletedGoals());
        assertEquals(1, stats.getActiveGoals());
        assertEquals(new BigDecimal("500"), stats.getTotalTargetAmount());
        assertEquals(new BigDecimal("350"), stats.getTotalCurrentAmount());
        assertEquals(new BigDecimal("200"), stats.getTotalRemainingAmount());
        assertEquals(new BigDecimal("70.00"), stats.getOverallProgress());
    }

    @Test
    void findById_otherUsersGoal_throwsNotFound() {
        UUID goalId = UUID.randomUUID();
        when(savingsGoalRepository.findByIdAndUserId(goalId, userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> savingsGoalService.findById(userId, goalId));
    }

    private void stubFind(SavingsGoal goal) {
        when(savingsGoalRepository.findByIdAndUserId(goal.getId(), userId)).thenReturn(Optional.of(goal));
    }

    private SavingsGoal goal(String title, String target, String current) {
        return SavingsGoal.builder()
                .id(UUID.randomUUID())
                .title(title)
                .targetAmount(new BigDecimal(target))
                .currentAmount(new BigDecimal(current))
                .contributions(new ArrayList<>())
                .build();
    }

    private Contribution contribution(String amount, LocalDateTime date) {
        return Contribution.builder()
                .id(UUID.randomUUID())
                .amount(new BigDecimal(amount))
                .type(ContributionType.DEPOSIT)
                .date(date)
                .build();
    }
}
