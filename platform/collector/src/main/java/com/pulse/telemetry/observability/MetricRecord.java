package com.pulse.telemetry.observability;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A recorded metric datapoint. Immutable.
 */
public record MetricRecord(String name, double value, Map<String, String> tags, Instant timestamp) {

    public MetricRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
        tags = Map.copyOf(tags);
    }
}
