package com.pulse.telemetry.observability;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A discrete observability event. Immutable.
 */
public record EventRecord(String name, String message, Severity severity, Map<String, String> tags, Instant timestamp) {

    public EventRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        message = message != null ? message : "";
        tags = Map.copyOf(tags);
    }
}
