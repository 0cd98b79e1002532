package com.pulse.telemetry.http.interceptors;

import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.http.HttpPipeline.Handler;
import com.pulse.telemetry.http.HttpPipeline.Interceptor;
import com.pulse.telemetry.http.HttpPipeline.Request;
import com.pulse.telemetry.http.HttpPipeline.Response;
import com.pulse.telemetry.observability.ObservabilityClient;
import com.pulse.telemetry.observability.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Measures request processing time.
 *
 * Records {@value #METRIC} tagged with path, method and status, exposes the
 * duration in the {@value #HEADER} response header, and emits a warning event
 * {@value #SLOW_EVENT} when the duration exceeds the threshold. A failed
 * handler is recorded with status 500.
 */
public final class ResponseTimeInterceptor implements Interceptor {

    private static final Logger log = LoggerFactory.getLogger(ResponseTimeInterceptor.class);

    public static final String METRIC = "http.response_time_ms";
    public static final String SLOW_EVENT = "http.request.slow";
    public static final String HEADER = "X-Response-Time-ms";

    private final ObservabilityClient client;
    private final Duration slowThreshold;
    private final LongSupplier nanoTime;

    public ResponseTimeInterceptor(ObservabilityClient client, Duration slowThreshold) {
        this(client, slowThreshold, System::nanoTime);
    }

    ResponseTimeInterceptor(ObservabilityClient client, Duration slowThreshold, LongSupplier nanoTime) {
        this.client = client;
        this.slowThreshold = slowThreshold;
        this.nanoTime = nanoTime;
    }

    public static ResponseTimeInterceptor fromConfig(ObservabilityClient client, TelemetryConfig.HttpConfig config) {
        return new ResponseTimeInterceptor(client, config.slowRequestThreshold());
    }

    @Override
    public CompletableFuture<Response> intercept(Request request, Handler next) {
        long startNanos = nanoTime.getAsLong();

        return next.handle(request).handle((response, error) -> {
            double durationMs = (nanoTime.getAsLong() - startNanos) / 1_000_000.0;
            int status = error == null && response != null ? response.status() : 500;
            record(request, status, durationMs);

            if (error != null) {
                throw Futures.asCompletion(error);
            }
            return response != null
                    ? response.withHeaderIfAbsent(HEADER, String.format(Locale.ROOT, "%.2f", durationMs))
                    : null;
        });
    }

    private void record(Request request, int status, double durationMs) {
        client.recordMetric(METRIC, durationMs, Map.of(
                "path", request.path(),
                "method", request.method().name(),
                "status", String.valueOf(status)));

        long thresholdMs = slowThreshold.toMillis();
        if (durationMs > thresholdMs) {
            client.recordEvent(SLOW_EVENT, "Slow request detected: " + request.path(), Severity.WARNING, Map.of(
                    "path", request.path(),
                    "method", request.method().name(),
                    "duration_ms", String.format(Locale.ROOT, "%.2f", durationMs),
                    "threshold_ms", String.valueOf(thresholdMs)));
        }
        log.debug("Request processed: {} {} -> {} ({}ms)", request.method(), request.path(), status,
                String.format(Locale.ROOT, "%.2f", durationMs));
    }
}
