package com.pulse.telemetry.observability.export;

import com.pulse.telemetry.observability.EventRecord;
import com.pulse.telemetry.observability.MetricRecord;
import com.pulse.telemetry.observability.Severity;
import com.pulse.telemetry.observability.SpanRecord;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class OpenTelemetryExporterTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private InMemorySpanExporter spans;
    private InMemoryMetricReader metrics;
    private OpenTelemetrySdk sdk;
    private OpenTelemetryExporter exporter;

    @BeforeEach
    void setUp() {
        spans = InMemorySpanExporter.create();
        metrics = InMemoryMetricReader.create();
        sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spans))
                        .build())
                .setMeterProvider(SdkMeterProvider.builder()
                        .registerMetricReader(metrics)
                        .build())
                .build();
        exporter = new OpenTelemetryExporter(sdk, "test-scope");
    }

    @AfterEach
    void tearDown() {
        sdk.getSdkTracerProvider().close();
        sdk.getSdkMeterProvider().close();
    }

    @Test
    void spanIsReplayedWithRecordedTimestamps() {
        SpanRecord record = new SpanRecord("abc123", "db.query", "ok", 250.0,
                START, START.plusMillis(250), Map.of("table", "users"), Optional.empty());

        exporter.exportSpan(record);

        SpanData span = spans.getFinishedSpanItems().get(0);
        assertEquals("db.query", span.getName());
        assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
        assertEquals("users", span.getAttributes().get(AttributeKey.stringKey("table")));
        assertEquals("abc123", span.getAttributes().get(OpenTelemetryExporter.ATTR_SPAN_ID));
        assertEquals(250, TimeUnit.NANOSECONDS.toMillis(span.getEndEpochNanos() - span.getStartEpochNanos()));
        assertEquals("test-scope", span.getInstrumentationScopeInfo().getName());
    }

    @Test
    void errorSpanCarriesDescription() {
        exporter.exportSpan(new SpanRecord("id", "upload", "error", 1.0,
                START, START, Map.of(), Optional.of("too large")));

        SpanData span = spans.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("too large", span.getStatus().getDescription());
    }

    @Test
    void failureStatusWithoutErrorIsError() {
        exporter.exportSpan(new SpanRecord("id", "task", "failure", 1.0, START, START, Map.of(), Optional.empty()));

        assertEquals(StatusCode.ERROR, spans.getFinishedSpanItems().get(0).getStatus().getStatusCode());
    }

    @Test
    void customStatusIsKeptAsAttribute() {
        exporter.exportSpan(new SpanRecord("id", "task", "retry", 1.0, START, START, Map.of(), Optional.empty()));

        SpanData span = spans.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.UNSET, span.getStatus().getStatusCode());
        assertEquals("retry", span.getAttributes().get(AttributeKey.stringKey("telemetry.status")));
    }

    @Test
    void metricsBecomeHistograms() {
        exporter.exportMetric(new MetricRecord("http.response_time_ms", 10.0, Map.of("path", "/a"), START));
        exporter.exportMetric(new MetricRecord("http.response_time_ms", 30.0, Map.of("path", "/a"), START));

        MetricData data = find(metrics.collectAllMetrics().stream().toList(), "http.response_time_ms");
        HistogramPointData point = data.getHistogramData().getPoints().iterator().next();
        assertEquals(2, point.getCount());
        assertEquals(40.0, point.getSum(), 1e-9);
        assertEquals("/a", point.getAttributes().get(AttributeKey.stringKey("path")));
    }

    @Test
    void eventsAreCountedByNameAndSeverity() {
        exporter.exportEvent(new EventRecord("disk.low", "5% left", Severity.WARNING, Map.of(), START));
        exporter.exportEvent(new EventRecord("disk.low", "4% left", Severity.WARNING, Map.of(), START));

        MetricData data = find(metrics.collectAllMetrics().stream().toList(), OpenTelemetryExporter.EVENTS_COUNTER);
        LongPointData point = data.getLongSumData().getPoints().iterator().next();
        assertEquals(2, point.getValue());
        assertEquals("disk.low", point.getAttributes().get(OpenTelemetryExporter.ATTR_EVENT_NAME));
        assertEquals("warning", point.getAttributes().get(OpenTelemetryExporter.ATTR_EVENT_SEVERITY));
    }

    private static MetricData find(List<MetricData> all, String name) {
        return all.stream()
                .filter(m -> m.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("metric not exported: " + name));
    }
}
