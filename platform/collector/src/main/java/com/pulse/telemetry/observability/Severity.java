package com.pulse.telemetry.observability;

import java.util.Locale;

/**
 * Event severity. Only affects log verbosity, never storage.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Lenient parse: case-insensitive, unknown or missing values map to {@link #INFO}.
     */
    public static Severity parse(String value) {
        if (value == null) {
            return INFO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "warning", "warn" -> WARNING;
            case "error" -> ERROR;
            case "critical" -> CRITICAL;
            default -> INFO;
        };
    }

    public boolean isError() {
        return this == ERROR || this == CRITICAL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
