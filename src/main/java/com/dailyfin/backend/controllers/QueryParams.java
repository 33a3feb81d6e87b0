package com.dailyfin.backend.controllers;

import java.util.Arrays;
import java.util.List;

final class QueryParams {

    private QueryParams() {
    }

    // "a, b,,c" -> [a, b, c]; vazio -> null (sem filtro)
    static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) return null;
        List<String> values = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
        return values.isEmpty() ? null : values;
    }
}
