package com.pulse.telemetry.observability;

import com.pulse.telemetry.base.Result;
import com.pulse.telemetry.base.Unit;
import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.observability.export.DefaultExporters;
import com.pulse.telemetry.observability.export.RecentTelemetryExporter;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;

import java.util.function.Supplier;

/**
 * Process bootstrap: builds the one collector instance and wires default exporters.
 *
 * Call once from startup code and pass {@link #client()} to the request pipeline
 * and the task framework. A {@link RecentTelemetryExporter} is always attached for
 * health and dashboard views. Forwarding exporter wiring never aborts startup; its
 * outcome is kept in {@link #defaultExporters()} for the caller to inspect or ignore.
 */
public final class Telemetry {

    private final ObservabilityClient client;
    private final TelemetryConfig config;
    private final RecentTelemetryExporter recent;
    private final Result<Unit> defaultExporters;

    private Telemetry(ObservabilityClient client, TelemetryConfig config, RecentTelemetryExporter recent,
                      Result<Unit> defaultExporters) {
        this.client = client;
        this.config = config;
        this.recent = recent;
        this.defaultExporters = defaultExporters;
    }

    public static Telemetry bootstrap(TelemetryConfig config) {
        return bootstrap(config, GlobalOpenTelemetry::get);
    }

    public static Telemetry bootstrap(TelemetryConfig config, Supplier<OpenTelemetry> backend) {
        ObservabilityClient client = ObservabilityClient.create(Retention.from(config.retention()));
        RecentTelemetryExporter recent = new RecentTelemetryExporter(config.recentCapacity());
        client.registerExporter(recent);
        Result<Unit> registration = DefaultExporters.register(client, config, backend);
        return new Telemetry(client, config, recent, registration);
    }

    public ObservabilityClient client() {
        return client;
    }

    public TelemetryConfig config() {
        return config;
    }

    public RecentTelemetryExporter recent() {
        return recent;
    }

    public Result<Unit> defaultExporters() {
        return defaultExporters;
    }
}
