package com.pulse.telemetry.observability;

import com.pulse.telemetry.config.TelemetryConfig;

/**
 * Caps for the completed-record buffers. Zero means unbounded; when a cap is
 * reached the oldest record is dropped.
 */
public record Retention(int maxMetrics, int maxEvents, int maxSpans) {

    public static final Retention UNBOUNDED = new Retention(0, 0, 0);

    public Retention {
        if (maxMetrics < 0 || maxEvents < 0 || maxSpans < 0) {
            throw new IllegalArgumentException("Retention caps must be >= 0");
        }
    }

    public static Retention from(TelemetryConfig.RetentionConfig config) {
        return new Retention(config.maxMetrics(), config.maxEvents(), config.maxSpans());
    }
}
