package com.dailyfin.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class DotenvLoaderTest {

    @Test
    void parse_handlesCommentsExportAndQuotes() {
        Map<String, String> entries = DotenvLoader.parse(List.of(
                "# comentário",
                "",
                "DB_URL=jdbc:postgresql://localhost:5432/dailyfin",
                "export JWT_SECRET=\"segredo com espaço\"",
                "PUSH_API_KEY='abc123'",
                "  PORT = 9090  "
        ));

        assertEquals("jdbc:postgresql://localhost:5432/dailyfin", entries.get("DB_URL"));
        assertEquals("segredo com espaço", entries.get("JWT_SECRET"));
        assertEquals("abc123", entries.get("PUSH_API_KEY"));
        assertEquals("9090", entries.get("PORT"));
    }

    @Test
    void parse_skipsMalformedAndEmptyValues() {
        Map<String, String> entries = DotenvLoader.parse(Arrays.asList(
                "=sem-chave",
                "SEM_IGUAL",
                "VAZIO=",
                "ASPAS_VAZIAS=\"\"",
                null
        ));

        assertEquals(0, entries.size());
        assertFalse(entries.containsKey("VAZIO"));
    }

    @Test
    void parse_lastOccurrenceWins() {
        Map<String, String> entries = DotenvLoader.parse(List.of("KEY=first", "KEY=second"));

        assertEquals("second", entries.get("KEY"));
    }
}
