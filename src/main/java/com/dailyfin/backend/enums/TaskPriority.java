package com.dailyfin.backend.enums;

/**
 * Prioridade de tarefa. {@link #rank()} menor = mais urgente.
 */
public enum TaskPriority {
    URGENT(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
