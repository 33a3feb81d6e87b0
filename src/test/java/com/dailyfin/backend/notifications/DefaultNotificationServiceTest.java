package com.dailyfin.backend.notifications;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import com.dailyfin.backend.enums.NotificationType;
import com.dailyfin.backend.notifications.provider.PushProviderClient;
import com.dailyfin.backend.notifications.provider.PushProviderClient.DeliveryReport;
import com.dailyfin.backend.realtime.PresenceRegistry;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.services.UserService;

@ExtendWith(MockitoExtension.class)
class DefaultNotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-07-01T09:00:00Z");

    @Mock
    private PushProviderClient providerClient;

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserService userService;

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private final PresenceRegistry presenceRegistry = new PresenceRegistry();

    private DefaultNotificationService notificationService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        notificationService = new DefaultNotificationService(providerClient, userRepository, userService,
                presenceRegistry, messagingTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void budgetAlert_warningBelowHundredPercent() {
        PushNotification sent = sendAndCapture(() ->
                notificationService.sendBudgetAlert(userId, "Food", new BigDecimal("84.40")));

        assertEquals(NotificationType.BUDGET_WARNING, sent.getType());
        assertEquals("Budget Warning", sent.getTitle());
        assertEquals("⚠️ Food: 84% of budget used", sent.getBody());
        assertEquals("84.40", sent.getData().get("percentage"));
    }

    @Test
    void budgetAlert_exceededAtHundredPercent() {
        PushNotification sent = sendAndCapture(() ->
                notificationService.sendBudgetAlert(userId, "Transport", new BigDecimal("100.00")));

        assertEquals(NotificationType.BUDGET_EXCEEDED, sent.getType());
        assertEquals("Budget Exceeded!", sent.getTitle());
    }

    @Test
    void savingsMilestone_hundredMeansCompleted() {
        PushNotification sent = sendAndCapture(() ->
                notificationService.sendSavingsMilestone(userId, "Viagem", 100));

        assertEquals(NotificationType.SAVINGS_COMPLETED, sent.getType());
        assertEquals("🎉 Viagem: 100% achieved!", sent.getBody());
    }

    @Test
    void taskReminder_withinADayIsDueToday() {
        PushNotification sent = sendAndCapture(() ->
                notificationService.sendTaskReminder(userId, "Pagar aluguel", LocalDateTime.of(2024, 7, 1, 20, 0)));

        assertEquals(NotificationType.TASK_DUE_TODAY, sent.getType());
        assertEquals("🔔 Task due today: Pagar aluguel", sent.getBody());
    }

    @Test
    void taskReminder_laterRoundsDaysUp() {
        PushNotification sent = sendAndCapture(() ->
                notificationService.sendTaskReminder(userId, "Renovar seguro", LocalDateTime.of(2024, 7, 3, 12, 0)));

        assertEquals(NotificationType.TASK_REMINDER, sent.getType());
        assertEquals("🔔 Reminder: Renovar seguro - Due in 3 days", sent.getBody());
    }

    @Test
    void chatPreview_truncatesLongText() {
        String longText = "x".repeat(60);

        assertEquals("x".repeat(50) + "...", DefaultNotificationService.preview(longText));
        assertEquals("curta", DefaultNotificationService.preview("curta"));
    }

    @Test
    void invalidTokensReportedByProviderAreRemoved() {
        when(userRepository.findDeviceTokens(userId)).thenReturn(List.of("ok", "stale"));
        when(providerClient.send(anyList(), any(PushNotification.class)))
                .thenReturn(new DeliveryReport(1, List.of("stale")));

        notificationService.sendChatNotification(userId, "Ana", "oi");

        verify(userService).removeDeviceTokens(userId, List.of("stale"));
    }

    @Test
    void onlineUserAlsoGetsRealtimeCopy() {
        presenceRegistry.connect(userId, "session");
        when(userRepository.findDeviceTokens(userId)).thenReturn(List.of());

        notificationService.sendChatNotification(userId, "Ana", "oi");

        verify(messagingTemplate).convertAndSendToUser(eq(userId.toString()),
                eq(DefaultNotificationService.USER_QUEUE), any(PushNotification.class));
        verify(providerClient, never()).send(anyList(), any());
    }

    @Test
    void providerFailureIsSwallowedAndLogged() {
        when(userRepository.findDeviceTokens(userId)).thenReturn(List.of("t1"));
        when(providerClient.send(anyList(), any(PushNotification.class)))
                .thenThrow(new IllegalStateException("gateway down"));

        notificationService.sendChatNotification(userId, "Ana", "oi");

        verify(userService, never()).removeDeviceTokens(any(), anyList());
        verify(messagingTemplate, never()).convertAndSendToUser(anyString(), anyString(), any());
    }

    private PushNotification sendAndCapture(Runnable action) {
        when(userRepository.findDeviceTokens(userId)).thenReturn(List.of("device-1"));
        when(providerClient.send(anyList(), any(PushNotification.class))).thenReturn(new DeliveryReport(1, List.of()));

        action.run();

        ArgumentCaptor<PushNotification> captor = ArgumentCaptor.forClass(PushNotification.class);
        verify(providerClient).send(eq(List.of("device-1")), captor.capture());
        return captor.getValue();
    }
}
