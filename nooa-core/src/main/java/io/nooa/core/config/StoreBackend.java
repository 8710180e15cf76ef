package io.nooa.core.config;

import java.util.Locale;

public enum StoreBackend {
    SQLITE,
    JSON;

    public static StoreBackend fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SQLITE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "json", "file" -> JSON;
            case "sqlite" -> SQLITE;
            default -> throw new IllegalArgumentException("Unsupported cron store backend: " + raw);
        };
    }
}
