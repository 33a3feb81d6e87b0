package com.dailyfin.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carrega um arquivo .env (desenvolvimento local) como System properties.
 *
 * Procura ".env" no diretório atual e depois em "backend/.env". Chaves já definidas
 * como variável de ambiente ou System property não são sobrescritas.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Path envPath = findEnvFile(List.of(Path.of(".env"), Path.of("backend", ".env")));
        if (envPath == null) {
            return;
        }

        try {
            Map<String, String> entries = parse(Files.readAllLines(envPath, StandardCharsets.UTF_8));
            int loaded = 0;

            for (Map.Entry<String, String> entry : entries.entrySet()) {
                String key = entry.getKey();
                if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
                    continue;
                }
                System.setProperty(key, entry.getValue());
                loaded++;
            }

            if (loaded > 0) {
                log.info("[DotenvLoader] {} chaves carregadas de {} (valores ocultos)",
                        loaded, envPath.toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] Falha ao ler .env (ignorado): {}", e.getMessage());
        }
    }

    /**
     * Interpreta linhas KEY=VALUE. Ignora comentários, linhas sem chave e valores vazios;
     * remove aspas simples ou duplas ao redor do valor. A última ocorrência de uma chave vence.
     */
    static Map<String, String> parse(List<String> lines) {
        Map<String, String> entries = new LinkedHashMap<>();

        for (String raw : lines) {
            if (raw == null) continue;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }

            int idx = line.indexOf('=');
            if (idx <= 0) continue;

            String key = line.substring(0, idx).trim();
            String value = line.substring(idx + 1).trim();

            if (value.length() >= 2
                    && ((value.startsWith("\"") && value.endsWith("\""))
                    || (value.startsWith("'") && value.endsWith("'")))) {
                value = value.substring(1, value.length() - 1);
            }

            if (key.isEmpty() || value.isEmpty()) continue;
            entries.put(key, value);
        }

        return entries;
    }

    private static Path findEnvFile(List<Path> candidates) {
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
