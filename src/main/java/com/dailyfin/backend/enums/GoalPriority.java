package com.dailyfin.backend.enums;

/**
 * Prioridade de uma meta de economia. A ordem de declaração é a ordem de exibição.
 */
public enum GoalPriority {
    HIGH,
    MEDIUM,
    LOW
}
