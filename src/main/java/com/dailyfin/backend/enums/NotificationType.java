package com.dailyfin.backend.enums;

public enum NotificationType {
    BUDGET_WARNING,
    BUDGET_EXCEEDED,
    SAVINGS_MILESTONE,
    SAVINGS_COMPLETED,
    TASK_REMINDER,
    TASK_DUE_TODAY,
    CHAT_MESSAGE
}
