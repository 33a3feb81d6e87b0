package com.dailyfin.backend.enums;

public enum RecurrenceInterval {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
