package com.pulse.telemetry.observability.export;

import com.pulse.telemetry.observability.EventRecord;
import com.pulse.telemetry.observability.MetricRecord;
import com.pulse.telemetry.observability.SpanRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent records and running totals for dashboards and health
 * endpoints. Totals survive eviction from the recent window; {@link #clear()}
 * resets both.
 */
public final class RecentTelemetryExporter implements TelemetryExporter {

    private final int capacity;
    private final Deque<MetricRecord> metrics = new ArrayDeque<>();
    private final Deque<EventRecord> events = new ArrayDeque<>();
    private final Deque<SpanRecord> spans = new ArrayDeque<>();

    private long metricsTotal;
    private long eventsTotal;
    private long eventErrors;
    private long spansTotal;
    private long spanErrors;

    public RecentTelemetryExporter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void exportMetric(MetricRecord metric) {
        push(metrics, metric);
        metricsTotal++;
    }

    @Override
    public synchronized void exportEvent(EventRecord event) {
        push(events, event);
        eventsTotal++;
        if (event.severity().isError()) {
            eventErrors++;
        }
    }

    @Override
    public synchronized void exportSpan(SpanRecord span) {
        push(spans, span);
        spansTotal++;
        if (span.hasError() || "error".equals(span.status()) || "failure".equals(span.status())) {
            spanErrors++;
        }
    }

    public synchronized Payload payload() {
        return new Payload(List.copyOf(metrics), List.copyOf(events), List.copyOf(spans), summary());
    }

    public synchronized Summary summary() {
        return new Summary(metricsTotal, eventsTotal, eventErrors, spansTotal, spanErrors);
    }

    public synchronized void clear() {
        metrics.clear();
        events.clear();
        spans.clear();
        metricsTotal = 0;
        eventsTotal = 0;
        eventErrors = 0;
        spansTotal = 0;
        spanErrors = 0;
    }

    private <R> void push(Deque<R> buffer, R record) {
        if (buffer.size() >= capacity) {
            buffer.pollFirst();
        }
        buffer.addLast(record);
    }

    /**
     * Snapshot of the recent window plus totals.
     */
    public record Payload(List<MetricRecord> metrics, List<EventRecord> events, List<SpanRecord> spans, Summary summary) {}

    /**
     * Running totals since creation or the last {@link #clear()}.
     */
    public record Summary(long metricsTotal, long eventsTotal, long eventErrors, long spansTotal, long spanErrors) {
        public double spanErrorRate() {
            return spansTotal > 0 ? (double) spanErrors / spansTotal : 0.0;
        }
    }

    @Override
    public String toString() {
        return "RecentTelemetryExporter[capacity=" + capacity + "]";
    }
}
