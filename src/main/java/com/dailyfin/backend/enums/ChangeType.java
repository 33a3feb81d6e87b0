package com.dailyfin.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    INCREASE("increase"),
    DECREASE("decrease"),
    SAME("same");

    private final String label;

    ChangeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
