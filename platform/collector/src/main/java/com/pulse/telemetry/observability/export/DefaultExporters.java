package com.pulse.telemetry.observability.export;

import com.pulse.telemetry.base.Result;
import com.pulse.telemetry.base.Unit;
import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.observability.ObservabilityClient;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Fallible, explicit registration of the default forwarding exporter.
 *
 * Never throws: an unavailable backend yields a failed {@link Result}, logged
 * here, and the collector keeps running without forwarding.
 */
public final class DefaultExporters {

    private static final Logger log = LoggerFactory.getLogger(DefaultExporters.class);

    private DefaultExporters() {}

    public static Result<Unit> register(ObservabilityClient client, TelemetryConfig config, Supplier<OpenTelemetry> backend) {
        TelemetryConfig.OpenTelemetryConfig otelConfig = config.openTelemetry();
        if (!otelConfig.enabled()) {
            log.info("OpenTelemetry exporter disabled by configuration");
            return Result.success(Unit.VALUE);
        }

        return Result.of(() -> {
                    OpenTelemetry otel = backend.get();
                    if (otel == null) {
                        throw new IllegalStateException("No OpenTelemetry instance available");
                    }
                    return new OpenTelemetryExporter(otel, otelConfig.instrumentationScope());
                })
                .map(exporter -> {
                    client.registerExporter(exporter);
                    log.info("Registered default exporter {}", exporter);
                    return Unit.VALUE;
                })
                .onFailure(e -> log.warn("Failed to register default telemetry exporters; continuing without forwarding", e));
    }
}
