package io.mailq.util;

import java.nio.file.Path;

/**
 * Environment variable utilities.
 *
 * Environment variables win over system properties; blank values count as unset.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static Path getPath(String key, Path defaultValue) {
        String value = get(key, null);
        return value != null ? Path.of(value) : defaultValue;
    }

    private Env() {}
}
