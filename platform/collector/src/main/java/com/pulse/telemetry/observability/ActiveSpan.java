package com.pulse.telemetry.observability;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A started, not yet completed span. Mutable; only touched under the client lock.
 */
final class ActiveSpan {

    static final String IN_PROGRESS = "in_progress";

    final String spanId;
    final String name;
    final Instant startTime;
    final long startNanos;
    final Map<String, String> tags;
    String status = IN_PROGRESS;

    ActiveSpan(String spanId, String name, Instant startTime, long startNanos, Map<String, String> tags) {
        this.spanId = spanId;
        this.name = name;
        this.startTime = startTime;
        this.startNanos = startNanos;
        this.tags = new HashMap<>(tags);
    }
}
