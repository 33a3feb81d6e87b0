package com.dailyfin.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classificação de consumo do orçamento mensal, com paleta fixa.
 */
public enum BudgetStatusLevel {
    SAFE("safe", "#27AE60"),
    WARNING("warning", "#F39C12"),
    EXCEEDED("exceeded", "#E74C3C");

    private final String label;
    private final String color;

    BudgetStatusLevel(String label, String color) {
        this.label = label;
        this.color = color;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }
}
