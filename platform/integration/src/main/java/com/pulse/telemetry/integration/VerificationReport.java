package com.pulse.telemetry.integration;

import java.util.List;

/**
 * Outcome of one verification pass, printed as text or JSON.
 */
public record VerificationReport(
        String cacheBackend,
        boolean cacheHit,
        boolean taskSucceeded,
        String taskOutput,
        int spanCount,
        int metricCount,
        int eventCount,
        List<SpanLine> spans
) {

    public VerificationReport {
        spans = List.copyOf(spans);
    }

    public record SpanLine(String name, String status, double durationMs) {}
}
