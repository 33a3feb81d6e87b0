package com.dailyfin.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public static final Set<TaskStatus> ACTIVE = EnumSet.of(TODO, IN_PROGRESS);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
