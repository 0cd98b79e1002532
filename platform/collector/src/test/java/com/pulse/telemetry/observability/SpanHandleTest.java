package com.pulse.telemetry.observability;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SpanHandleTest {

    private final ObservabilityClient client = ObservabilityClient.create();

    @Test
    void closeCompletesWithLastStatus() {
        try (SpanHandle span = client.span("cache.refresh")) {
            span.addTag("region", "eu").setStatus("PARTIAL");
        }

        SpanRecord record = client.getCompletedSpans().get(0);
        assertEquals("partial", record.status());
        assertEquals("eu", record.tags().get("region"));
    }

    @Test
    void closeWithoutStatusIsOk() {
        try (SpanHandle span = client.span("noop")) {
            assertNotNull(span.spanId());
            assertEquals(Optional.of("in_progress"), client.getSpanStatus(span.spanId()));
        }

        assertEquals("ok", client.getCompletedSpans().get(0).status());
    }

    @Test
    void failThenCloseCompletesOnce() {
        SpanHandle span = client.span("upload");

        Optional<SpanRecord> failed = span.fail(new IllegalArgumentException("too large"));
        span.close();
        span.close();

        assertTrue(failed.isPresent());
        assertEquals("error", failed.get().status());
        assertEquals(Optional.of("too large"), failed.get().error());
        assertEquals(1, client.getCompletedSpans().size());
        assertTrue(span.fail(new RuntimeException("again")).isEmpty());
    }

    @Test
    void throwingScopeRunThroughInSpanIsRecordedAsError() {
        IllegalStateException boom = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> client.inSpan("x", Map.of(), span -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        SpanRecord record = client.getCompletedSpans("x").get(0);
        assertEquals("error", record.status());
        assertEquals(Optional.of("boom"), record.error());
    }

    @Test
    void failOnErrorPathWinsOverClose() {
        RuntimeException boom = new RuntimeException("boom");

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> {
            try (SpanHandle span = client.span("x")) {
                try {
                    throw boom;
                } catch (RuntimeException e) {
                    span.fail(e);
                    throw e;
                }
            }
        });

        assertSame(boom, thrown);
        List<SpanRecord> spans = client.getCompletedSpans("x");
        assertEquals(1, spans.size());
        assertEquals("error", spans.get(0).status());
        assertEquals(Optional.of("boom"), spans.get(0).error());
    }

    @Test
    void exceptionWithoutMessageUsesToString() {
        SpanHandle span = client.span("npe");

        SpanRecord record = span.fail(new NullPointerException()).orElseThrow();

        assertEquals("java.lang.NullPointerException", record.error().orElseThrow());
    }

    @Test
    void handleIsDetachedAfterReset() {
        SpanHandle span = client.span("orphan");
        client.reset();

        span.close();

        assertTrue(client.getCompletedSpans().isEmpty());
    }
}
