package com.pulse.telemetry.observability;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one active span. Obtained only from {@link ObservabilityClient#span}.
 *
 * The scoped form is {@link ObservabilityClient#inSpan}, which completes the span
 * "error" and rethrows when the body fails:
 * <pre>
 *   client.inSpan("cache.refresh", Map.of("region", region), span -&gt; refresh());
 * </pre>
 *
 * The handle itself is for callers that decide the outcome themselves, typically
 * asynchronous code completing from a callback: {@link #fail(Throwable)} on the
 * error path, {@link #close()} otherwise. {@code close()} can not see an exception
 * leaving a try-with-resources block and completes such a span with the last status
 * set, so a throwing scope must call {@code fail} before the handle is closed.
 * Whichever of the two runs first completes the span; later calls are no-ops.
 */
public final class SpanHandle implements AutoCloseable {

    private final ObservabilityClient client;
    private final String spanId;
    private final AtomicBoolean completed = new AtomicBoolean(false);

    SpanHandle(ObservabilityClient client, String spanId) {
        this.client = client;
        this.spanId = spanId;
    }

    public String spanId() {
        return spanId;
    }

    public SpanHandle addTag(String key, Object value) {
        client.addSpanTag(spanId, key, value);
        return this;
    }

    public SpanHandle setStatus(String status) {
        client.setSpanStatus(spanId, status);
        return this;
    }

    /**
     * Complete with status "error" and the throwable's description.
     * Does not rethrow; the caller keeps control of the exception.
     */
    public Optional<SpanRecord> fail(Throwable error) {
        if (!completed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        return client.completeSpan(spanId, ObservabilityClient.ERROR, Errors.describe(error));
    }

    /**
     * Complete with the last status set, or "ok". Only for scopes that exit normally;
     * an error path calls {@link #fail(Throwable)} first.
     */
    @Override
    public void close() {
        if (completed.compareAndSet(false, true)) {
            client.completeSpan(spanId);
        }
    }
}
