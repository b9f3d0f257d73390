package com.efaktur.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads DJP endpoint/timeout and OCR settings from a local ".env" file.
 *
 * Each key=value pair becomes a System property unless the same key is already set as an environment
 * variable or System property. A missing file is not an error.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Optional<Path> envPath = locate(List.of(Path.of(".env"), Path.of("config", ".env")));
        if (envPath.isEmpty()) {
            return;
        }

        try {
            int loaded = load(Files.readAllLines(envPath.get(), StandardCharsets.UTF_8));
            if (loaded > 0) {
                log.info("[Dotenv] Loaded {} keys from {} (values hidden)", loaded, envPath.get().toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[Dotenv] Failed to read {} (ignored): {}", envPath.get(), e.getMessage());
        }
    }

    static int load(List<String> lines) {
        int loaded = 0;
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
            String value = unquote(line.substring(idx + 1).trim());
            if (key.isEmpty() || value.isEmpty()) continue;

            if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
                continue;
            }

            System.setProperty(key, value);
            loaded++;
        }
        return loaded;
    }

    private static Optional<Path> locate(List<Path> candidates) {
        return candidates.stream()
                .filter(p -> Files.exists(p) && Files.isRegularFile(p))
                .findFirst();
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
