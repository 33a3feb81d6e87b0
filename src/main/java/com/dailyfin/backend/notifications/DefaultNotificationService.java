package com.dailyfin.backend.notifications;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.dailyfin.backend.enums.NotificationType;
import com.dailyfin.backend.notifications.provider.PushProviderClient;
import com.dailyfin.backend.realtime.PresenceRegistry;
import com.dailyfin.backend.repositories.UserRepository;
import com.dailyfin.backend.services.UserService;

@Service
public class DefaultNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultNotificationService.class);

    public static final String USER_QUEUE = "/queue/notifications";
    static final int CHAT_PREVIEW_LENGTH = 50;

    private final PushProviderClient providerClient;
    private final UserRepository userRepository;
    private final UserService userService;
    private final PresenceRegistry presenceRegistry;
    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public DefaultNotificationService(
            PushProviderClient providerClient,
            UserRepository userRepository,
            UserService userService,
            PresenceRegistry presenceRegistry,
            SimpMessagingTemplate messagingTemplate,
            Clock clock
    ) {
        this.providerClient = providerClient;
        this.userRepository = userRepository;
        this.userService = userService;
        this.presenceRegistry = presenceRegistry;
        this.messagingTemplate = messagingTemplate;
        this.clock = clock;
    }

    @Override
    @Async("notificationTaskExecutor")
    public void sendBudgetAlert(UUID userId, String categoryName, BigDecimal percentage) {
        boolean exceeded = percentage.compareTo(new BigDecimal("100")) >= 0;
        String emoji = exceeded ? "🚨" : "⚠️";

        dispatch(userId, PushNotification.builder()
                .type(exceeded ? NotificationType.BUDGET_EXCEEDED : NotificationType.BUDGET_WARNING)
                .title(exceeded ? "Budget Exceeded!" : "Budget Warning")
                .body(emoji + " " + categoryName + ": " + wholePercent(percentage) + "% of budget used")
                .data(Map.of(
                        "categoryName", categoryName,
                        "percentage", percentage.toPlainString()
                ))
                .build());
    }

    @Override
    @Async("notificationTaskExecutor")
    public void sendSavingsMilestone(UUID userId, String goalTitle, int milestone) {
        boolean completed = milestone >= 100;
        String emoji = completed ? "🎉" : "🎯";

        dispatch(userId, PushNotification.builder()
                .type(completed ? NotificationType.SAVINGS_COMPLETED : NotificationType.SAVINGS_MILESTONE)
                .title(completed ? "Goal Completed!" : "Savings Milestone")
                .body(emoji + " " + goalTitle + ": " + milestone + "% achieved!")
                .data(Map.of(
                        "goalTitle", goalTitle,
                        "percentage", String.valueOf(milestone)
                ))
                .build());
    }

    @Override
    @Async("notificationTaskExecutor")
    public void sendTaskReminder(UUID userId, String taskTitle, LocalDateTime dueDate) {
        Duration untilDue = Duration.between(LocalDateTime.now(clock), dueDate);
        double hoursUntilDue = untilDue.toMinutes() / 60.0;

        NotificationType type;
        String body;
        if (hoursUntilDue <= 24) {
            type = NotificationType.TASK_DUE_TODAY;
            body = "🔔 Task due today: " + taskTitle;
        } else {
            type = NotificationType.TASK_REMINDER;
            long days = (long) Math.ceil(hoursUntilDue / 24);
            body = "🔔 Reminder: " + taskTitle + " - Due in " + days + " days";
        }

        dispatch(userId, PushNotification.builder()
                .type(type)
                .title("Task Reminder")
                .body(body)
                .data(Map.of(
                        "taskTitle", taskTitle,
                        "dueDate", dueDate.toString()
                ))
                .build());
    }

    @Override
    @Async("notificationTaskExecutor")
    public void sendChatNotification(UUID receiverId, String senderName, String text) {
        dispatch(receiverId, PushNotification.builder()
                .type(NotificationType.CHAT_MESSAGE)
                .title("💬 " + senderName)
                .body(preview(text))
                .data(Map.of("senderName", senderName))
                .build());
    }

    static String preview(String text) {
        if (text == null) return "";
        return text.length() > CHAT_PREVIEW_LENGTH
                ? text.substring(0, CHAT_PREVIEW_LENGTH) + "..."
                : text;
    }

    private void dispatch(UUID userId, PushNotification notification) {
        try {
            if (presenceRegistry.isOnline(userId)) {
                messagingTemplate.convertAndSendToUser(userId.toString(), USER_QUEUE, notification);
            }

            List<String> tokens = userRepository.findDeviceTokens(userId);
            if (tokens.isEmpty()) {
                logger.debug("[Notification] Usuário {} sem tokens de dispositivo", userId);
                return;
            }

            PushProviderClient.DeliveryReport report = providerClient.send(tokens, notification);
            logger.info("[Notification] {} enviada: {}/{} dispositivos",
                    notification.getType(), report.successCount(), tokens.size());

            if (!report.invalidTokens().isEmpty()) {
                userService.removeDeviceTokens(userId, report.invalidTokens());
                logger.info("[Notification] {} tokens inválidos removidos do usuário {}",
                        report.invalidTokens().size(), userId);
            }
        } catch (Exception e) {
            logger.warn("[Notification] Falha ao enviar {} para o usuário {}: {}",
                    notification.getType(), userId, e.getMessage());
        }
    }

    private static String wholePercent(BigDecimal percentage) {
        return percentage.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
