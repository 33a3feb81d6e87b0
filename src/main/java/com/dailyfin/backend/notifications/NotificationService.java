package com.dailyfin.backend.notifications;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Notificações de melhor esforço. Falhas são registradas em log e nunca
 * propagadas para quem chamou.
 */
public interface NotificationService {

    void sendBudgetAlert(UUID userId, String categoryName, BigDecimal percentage);

    void sendSavingsMilestone(UUID userId, String goalTitle, int milestone);

    void sendTaskReminder(UUID userId, String taskTitle, LocalDateTime dueDate);

    void sendChatNotification(UUID receiverId, String senderName, String text);
}
