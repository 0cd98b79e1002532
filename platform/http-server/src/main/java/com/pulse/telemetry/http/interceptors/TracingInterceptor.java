package com.pulse.telemetry.http.interceptors;

import com.pulse.telemetry.http.HttpPipeline.Handler;
import com.pulse.telemetry.http.HttpPipeline.Interceptor;
import com.pulse.telemetry.http.HttpPipeline.Request;
import com.pulse.telemetry.http.HttpPipeline.Response;
import com.pulse.telemetry.observability.ObservabilityClient;
import com.pulse.telemetry.observability.SpanHandle;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Opens one {@value #SPAN_NAME} span per request.
 *
 * The span is tagged with method and path before the next handler runs, and with
 * {@code status_code} once the response is available. Status is "error" for
 * 5xx responses, "ok" otherwise. A handler that throws, or whose future fails,
 * completes the span as "error"; the failure reaches the caller unchanged.
 */
public final class TracingInterceptor implements Interceptor {

    public static final String SPAN_NAME = "http.request";

    private final ObservabilityClient client;

    public TracingInterceptor(ObservabilityClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<Response> intercept(Request request, Handler next) {
        SpanHandle span = client.span(SPAN_NAME, Map.of(
                "method", request.method().name(),
                "path", request.path()));

        CompletableFuture<Response> response;
        try {
            response = Objects.requireNonNull(next.handle(request), "handler returned no response future");
        } catch (RuntimeException | Error e) {
            span.fail(e);
            throw e;
        }

        return response.whenComplete((res, error) -> {
            if (error != null) {
                span.fail(Futures.unwrap(error));
                return;
            }
            if (res != null) {
                span.addTag("status_code", res.status());
                span.setStatus(res.status() >= 500 ? "error" : "ok");
            }
            span.close();
        });
    }
}
