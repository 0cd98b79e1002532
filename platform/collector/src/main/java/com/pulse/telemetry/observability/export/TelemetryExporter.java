package com.pulse.telemetry.observability.export;

import com.pulse.telemetry.observability.EventRecord;
import com.pulse.telemetry.observability.MetricRecord;
import com.pulse.telemetry.observability.SpanRecord;

import java.util.function.Consumer;

/**
 * Pluggable sink receiving a copy of each captured record.
 *
 * Every hook has a no-op default, so an exporter implements only the payload
 * types it cares about. Hooks are invoked after the record is stored, outside
 * the collector's lock, and each call is isolated: an exception thrown here is
 * logged by the collector and never reaches the caller or other exporters.
 *
 * Usage:
 * <pre>
 *   client.registerExporter(TelemetryExporter.spans(span -&gt; shipper.send(span)));
 * </pre>
 */
public interface TelemetryExporter {

    default void exportMetric(MetricRecord metric) {}

    default void exportEvent(EventRecord event) {}

    default void exportSpan(SpanRecord span) {}

    // ========================================================================
    // Narrow exporters
    // ========================================================================

    static TelemetryExporter metrics(Consumer<MetricRecord> sink) {
        return new TelemetryExporter() {
            @Override
            public void exportMetric(MetricRecord metric) {
                sink.accept(metric);
            }

            @Override
            public String toString() {
                return "MetricsExporter[" + sink + "]";
            }
        };
    }

    static TelemetryExporter events(Consumer<EventRecord> sink) {
        return new TelemetryExporter() {
            @Override
            public void exportEvent(EventRecord event) {
                sink.accept(event);
            }

            @Override
            public String toString() {
                return "EventsExporter[" + sink + "]";
            }
        };
    }

    static TelemetryExporter spans(Consumer<SpanRecord> sink) {
        return new TelemetryExporter() {
            @Override
            public void exportSpan(SpanRecord span) {
                sink.accept(span);
            }

            @Override
            public String toString() {
                return "SpansExporter[" + sink + "]";
            }
        };
    }
}
