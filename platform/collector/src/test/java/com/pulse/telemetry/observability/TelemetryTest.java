package com.pulse.telemetry.observability;

import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.observability.export.OpenTelemetryExporter;
import com.pulse.telemetry.observability.export.RecentTelemetryExporter;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TelemetryTest {

    @Test
    void bootstrapRegistersRecentAndForwardingExporters() {
        Telemetry telemetry = Telemetry.bootstrap(TelemetryConfig.parse(""), OpenTelemetry::noop);

        assertTrue(telemetry.defaultExporters().isSuccess());
        assertEquals(2, telemetry.client().exporters().size());
        assertTrue(telemetry.client().exporters().stream().anyMatch(e -> e instanceof OpenTelemetryExporter));

        telemetry.client().recordMetric("m", 1);
        assertEquals(1, telemetry.recent().summary().metricsTotal());
    }

    @Test
    void unavailableBackendFailsSoft() {
        Telemetry telemetry = Telemetry.bootstrap(TelemetryConfig.parse(""), () -> {
            throw new IllegalStateException("backend not installed");
        });

        assertTrue(telemetry.defaultExporters().isFailure());
        assertEquals("backend not installed", telemetry.defaultExporters().error().orElseThrow().getMessage());
        assertEquals(1, telemetry.client().exporters().size());
        assertTrue(telemetry.client().exporters().get(0) instanceof RecentTelemetryExporter);

        telemetry.client().recordEvent("still", "works");
        assertEquals(1, telemetry.client().getEvents().size());
    }

    @Test
    void nullBackendFailsSoft() {
        Telemetry telemetry = Telemetry.bootstrap(TelemetryConfig.parse(""), () -> null);

        assertTrue(telemetry.defaultExporters().isFailure());
    }

    @Test
    void disabledForwardingSkipsBackend() {
        TelemetryConfig config = TelemetryConfig.parse("telemetry.exporters.opentelemetry.enabled = false");

        Telemetry telemetry = Telemetry.bootstrap(config, () -> {
            throw new AssertionError("backend must not be touched");
        });

        assertTrue(telemetry.defaultExporters().isSuccess());
        assertEquals(1, telemetry.client().exporters().size());
    }

    @Test
    void retentionComesFromConfig() {
        TelemetryConfig config = TelemetryConfig.parse("telemetry.retention { max-metrics = 3, max-spans = 7 }");

        Telemetry telemetry = Telemetry.bootstrap(config, OpenTelemetry::noop);

        assertEquals(new Retention(3, 0, 7), telemetry.client().retention());
    }
}
