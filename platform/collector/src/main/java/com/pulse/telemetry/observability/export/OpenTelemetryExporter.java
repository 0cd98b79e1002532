package com.pulse.telemetry.observability.export;

import com.pulse.telemetry.observability.EventRecord;
import com.pulse.telemetry.observability.MetricRecord;
import com.pulse.telemetry.observability.SpanRecord;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards captured records to an OpenTelemetry backend.
 *
 * ALL OpenTelemetry types are confined to this class.
 *
 * - metrics: one histogram per metric name, tags as attributes
 * - events: counter {@value #EVENTS_COUNTER} with event name and severity
 * - spans: replayed with the recorded start/end timestamps as root spans
 */
public final class OpenTelemetryExporter implements TelemetryExporter {

    static final String EVENTS_COUNTER = "telemetry.events";

    static final AttributeKey<String> ATTR_SPAN_ID = AttributeKey.stringKey("telemetry.span_id");
    static final AttributeKey<String> ATTR_EVENT_NAME = AttributeKey.stringKey("event.name");
    static final AttributeKey<String> ATTR_EVENT_SEVERITY = AttributeKey.stringKey("event.severity");

    private final Tracer tracer;
    private final Meter meter;
    private final LongCounter eventCounter;
    private final Map<String, DoubleHistogram> histograms = new ConcurrentHashMap<>();
    private final String scope;

    public OpenTelemetryExporter(OpenTelemetry otel, String instrumentationScope) {
        this.scope = instrumentationScope;
        this.tracer = otel.getTracer(instrumentationScope);
        this.meter = otel.getMeter(instrumentationScope);
        this.eventCounter = meter.counterBuilder(EVENTS_COUNTER)
                .setDescription("Telemetry events by name and severity")
                .build();
    }

    @Override
    public void exportMetric(MetricRecord metric) {
        histograms.computeIfAbsent(metric.name(), name -> meter.histogramBuilder(name).build())
                .record(metric.value(), attributes(metric.tags()));
    }

    @Override
    public void exportEvent(EventRecord event) {
        Attributes attributes = attributes(event.tags()).toBuilder()
                .put(ATTR_EVENT_NAME, event.name())
                .put(ATTR_EVENT_SEVERITY, event.severity().label())
                .build();
        eventCounter.add(1, attributes);
    }

    @Override
    public void exportSpan(SpanRecord record) {
        Span span = tracer.spanBuilder(record.name())
                .setParent(Context.root())
                .setSpanKind(SpanKind.INTERNAL)
                .setStartTimestamp(record.startTime())
                .setAllAttributes(attributes(record.tags()))
                .setAttribute(ATTR_SPAN_ID, record.spanId())
                .startSpan();

        if (record.hasError()) {
            span.setStatus(StatusCode.ERROR, record.error().get());
        } else {
            switch (record.status()) {
                case "ok", "success" -> span.setStatus(StatusCode.OK);
                case "error", "failure" -> span.setStatus(StatusCode.ERROR, record.status());
                default -> span.setAttribute("telemetry.status", record.status());
            }
        }
        span.end(record.endTime());
    }

    private static Attributes attributes(Map<String, String> tags) {
        AttributesBuilder builder = Attributes.builder();
        tags.forEach(builder::put);
        return builder.build();
    }

    @Override
    public String toString() {
        return "OpenTelemetryExporter[" + scope + "]";
    }
}
