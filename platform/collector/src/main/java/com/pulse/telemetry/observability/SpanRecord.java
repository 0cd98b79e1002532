package com.pulse.telemetry.observability;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A completed span. Immutable; produced exactly once per started span.
 *
 * @param durationMs measured on the monotonic clock, independent of {@code startTime}/{@code endTime}
 */
public record SpanRecord(
        String spanId,
        String name,
        String status,
        double durationMs,
        Instant startTime,
        Instant endTime,
        Map<String, String> tags,
        Optional<String> error
) {

    public SpanRecord {
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        tags = Map.copyOf(tags);
        error = error != null ? error : Optional.empty();
    }

    public boolean hasError() {
        return error.isPresent();
    }
}
