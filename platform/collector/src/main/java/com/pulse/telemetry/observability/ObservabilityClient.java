package com.pulse.telemetry.observability;

import com.pulse.telemetry.id.IdGenerator;
import com.pulse.telemetry.observability.export.TelemetryExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * In-process telemetry collector: metrics, events and spans behind one API.
 *
 * One instance is constructed at process start (see {@link Telemetry#bootstrap})
 * and handed to the request pipeline and the task framework. All internal tables
 * are guarded by a single re-entrant lock held only for O(1) list/map work;
 * exporters are notified after the lock is released.
 *
 * Only {@link #recordMetric} rejects input. Every operation addressing a span or
 * task by id treats an unknown id as a no-op, so telemetry never becomes a cause
 * of application failure.
 *
 * Usage:
 * <pre>
 *   ObservabilityClient client = ObservabilityClient.create();
 *
 *   client.recordMetric("cache.hit_ratio", 0.93, Map.of("cache", "sessions"));
 *   client.recordEvent("deploy.finished", "Rolled out build 42");
 *
 *   client.inSpan("db.migrate", Map.of("schema", "v7"), span -&gt; migrate());
 * </pre>
 */
public final class ObservabilityClient {

    private static final Logger log = LoggerFactory.getLogger(ObservabilityClient.class);

    static final String OK = "ok";
    static final String ERROR = "error";

    public static final String TASK_SPAN = "task";
    public static final String TASK_RUNTIME_METRIC = "task.runtime_ms";
    public static final String TASK_STARTED_EVENT = "task.started";
    public static final String TASK_COMPLETED_EVENT = "task.completed";
    public static final String TASK_FAILED_EVENT = "task.failed";
    public static final String UNKNOWN_TASK_ID = "unknown";

    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<MetricRecord> metrics = new ArrayDeque<>();
    private final Deque<EventRecord> events = new ArrayDeque<>();
    private final Deque<SpanRecord> completedSpans = new ArrayDeque<>();
    private final Map<String, ActiveSpan> activeSpans = new HashMap<>();
    private final Map<String, String> taskSpans = new HashMap<>();
    private final List<TelemetryExporter> exporters = new ArrayList<>();

    private final Retention retention;
    private final Clock wallClock;
    private final LongSupplier monotonicNanos;
    private final Supplier<String> spanIds;
    private final Supplier<String> taskIds;

    private ObservabilityClient(Builder builder) {
        this.retention = builder.retention;
        this.wallClock = builder.wallClock;
        this.monotonicNanos = builder.monotonicNanos;
        this.spanIds = builder.spanIds;
        this.taskIds = builder.taskIds;
    }

    public static ObservabilityClient create() {
        return builder().build();
    }

    public static ObservabilityClient create(Retention retention) {
        return builder().retention(retention).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Metrics
    // ========================================================================

    public MetricRecord recordMetric(String name, double value) {
        return recordMetric(name, value, Map.of());
    }

    public MetricRecord recordMetric(String name, Object value) {
        return recordMetric(name, value, Map.of());
    }

    /**
     * Record a numeric metric.
     *
     * @throws InvalidMetricValueException if {@code value} is not a boolean, integral,
     *         floating-point or decimal number; nothing is recorded in that case
     */
    public MetricRecord recordMetric(String name, Object value, Map<String, ?> tags) {
        double metricValue = MetricValues.coerce(name, value);
        MetricRecord record = new MetricRecord(name, metricValue, Tags.normalize(tags), wallClock.instant());

        lock.lock();
        try {
            append(metrics, record, retention.maxMetrics());
        } finally {
            lock.unlock();
        }

        log.debug("Metric recorded: {}={} {}", name, metricValue, record.tags());
        notifyExporters("exportMetric", record, TelemetryExporter::exportMetric);
        return record;
    }

    public List<MetricRecord> getMetrics() {
        return snapshot(metrics);
    }

    public List<MetricRecord> getMetrics(String name) {
        return getMetrics().stream().filter(m -> m.name().equals(name)).toList();
    }

    // ========================================================================
    // Events
    // ========================================================================

    public EventRecord recordEvent(String name, String message) {
        return recordEvent(name, message, Severity.INFO, Map.of());
    }

    public EventRecord recordEvent(String name, String message, Map<String, ?> tags) {
        return recordEvent(name, message, Severity.INFO, tags);
    }

    public EventRecord recordEvent(String name, String message, String severity, Map<String, ?> tags) {
        return recordEvent(name, message, Severity.parse(severity), tags);
    }

    /**
     * Record a structured event. Severity selects the log level only; null means INFO.
     */
    public EventRecord recordEvent(String name, String message, Severity severity, Map<String, ?> tags) {
        if (severity == null) {
            severity = Severity.INFO;
        }
        EventRecord record = new EventRecord(name, message, severity, Tags.normalize(tags), wallClock.instant());

        lock.lock();
        try {
            append(events, record, retention.maxEvents());
        } finally {
            lock.unlock();
        }

        switch (severity) {
            case ERROR, CRITICAL -> log.error("Telemetry event {} [{}]: {} {}", name, severity.label(), message, record.tags());
            case WARNING -> log.warn("Telemetry event {}: {} {}", name, message, record.tags());
            default -> log.info("Telemetry event {}: {} {}", name, message, record.tags());
        }
        notifyExporters("exportEvent", record, TelemetryExporter::exportEvent);
        return record;
    }

    public List<EventRecord> getEvents() {
        return snapshot(events);
    }

    public List<EventRecord> getEvents(String name) {
        return getEvents().stream().filter(e -> e.name().equals(name)).toList();
    }

    // ========================================================================
    // Spans
    // ========================================================================

    /**
     * Open a span and return its handle. The caller completes it with
     * {@link SpanHandle#fail} or {@link SpanHandle#close}; prefer {@link #inSpan}
     * for synchronous work, which records a thrown exception as "error".
     */
    public SpanHandle span(String name) {
        return span(name, Map.of());
    }

    public SpanHandle span(String name, Map<String, ?> tags) {
        return new SpanHandle(this, startSpan(name, tags));
    }

    public <T, E extends Exception> T inSpan(String name, SpanBody<T, E> body) throws E {
        return inSpan(name, Map.of(), body);
    }

    /**
     * Run {@code body} inside a span. If the body throws, the span completes with
     * status "error" and the exception's description, and the same exception
     * object is rethrown. Otherwise the span completes with the last status set,
     * or "ok".
     */
    public <T, E extends Exception> T inSpan(String name, Map<String, ?> tags, SpanBody<T, E> body) throws E {
        try (SpanHandle span = span(name, tags)) {
            try {
                return body.apply(span);
            } catch (Throwable t) {
                span.fail(t);
                throw t;
            }
        }
    }

    public String startSpan(String name) {
        return startSpan(name, Map.of());
    }

    /**
     * Open a span with status "in_progress" and return its process-unique id.
     */
    public String startSpan(String name, Map<String, ?> tags) {
        String spanId = spanIds.get();
        ActiveSpan active = new ActiveSpan(spanId, name, wallClock.instant(), monotonicNanos.getAsLong(), Tags.normalize(tags));

        lock.lock();
        try {
            activeSpans.put(spanId, active);
        } finally {
            lock.unlock();
        }

        log.debug("Span started: {} id={} {}", name, spanId, active.tags);
        return spanId;
    }

    public void addSpanTag(String spanId, String key, Object value) {
        lock.lock();
        try {
            ActiveSpan span = activeSpans.get(spanId);
            if (span != null) {
                span.tags.put(String.valueOf(key), String.valueOf(value));
            }
        } finally {
            lock.unlock();
        }
    }

    public void setSpanStatus(String spanId, String status) {
        lock.lock();
        try {
            ActiveSpan span = activeSpans.get(spanId);
            if (span != null && status != null) {
                span.status = status.toLowerCase(Locale.ROOT);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getSpanStatus(String spanId) {
        lock.lock();
        try {
            ActiveSpan span = activeSpans.get(spanId);
            return span != null ? Optional.of(span.status) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<SpanRecord> completeSpan(String spanId) {
        return completeSpan(spanId, null, null);
    }

    /**
     * Complete an active span. Returns empty, without error, when the span is
     * unknown or already completed.
     *
     * @param status explicit terminal status; when null the status set on the span
     *               is kept, or "ok" if none was set
     * @param error  error description, or null
     */
    public Optional<SpanRecord> completeSpan(String spanId, String status, String error) {
        ActiveSpan active;
        SpanRecord record;

        lock.lock();
        try {
            active = activeSpans.remove(spanId);
            if (active == null) {
                return Optional.empty();
            }
            long endNanos = monotonicNanos.getAsLong();
            Instant endTime = wallClock.instant();
            double durationMs = (endNanos - active.startNanos) / 1_000_000.0;
            String finalStatus = resolveStatus(status, active.status);

            record = new SpanRecord(spanId, active.name, finalStatus, durationMs,
                    active.startTime, endTime, active.tags, Optional.ofNullable(error));
            append(completedSpans, record, retention.maxSpans());
        } finally {
            lock.unlock();
        }

        if (record.hasError()) {
            log.error("Span completed with error: {} id={} status={} duration={}ms error={} {}",
                    record.name(), spanId, record.status(), String.format(Locale.ROOT, "%.2f", record.durationMs()),
                    record.error().get(), record.tags());
        } else {
            log.debug("Span completed: {} id={} status={} duration={}ms {}",
                    record.name(), spanId, record.status(), String.format(Locale.ROOT, "%.2f", record.durationMs()), record.tags());
        }
        notifyExporters("exportSpan", record, TelemetryExporter::exportSpan);
        return Optional.of(record);
    }

    public List<SpanRecord> getCompletedSpans() {
        return snapshot(completedSpans);
    }

    public List<SpanRecord> getCompletedSpans(String name) {
        return getCompletedSpans().stream().filter(s -> s.name().equals(name)).toList();
    }

    public int activeSpanCount() {
        lock.lock();
        try {
            return activeSpans.size();
        } finally {
            lock.unlock();
        }
    }

    private static String resolveStatus(String explicit, String current) {
        if (explicit != null) {
            return explicit.toLowerCase(Locale.ROOT);
        }
        if (current != null && !ActiveSpan.IN_PROGRESS.equals(current)) {
            return current;
        }
        return OK;
    }

    // ========================================================================
    // Tasks
    // ========================================================================

    /**
     * Open a span for an asynchronous task and remember the task id mapping.
     *
     * @param taskId external task id; generated when null
     * @param queue  optional queue name, tagged when present
     * @return the span id
     */
    public String beginTask(String taskId, String taskName, String queue) {
        String taskIdentifier = taskId != null ? taskId : taskIds.get();
        Map<String, String> tags = new HashMap<>();
        tags.put("task_name", taskName);
        if (queue != null && !queue.isEmpty()) {
            tags.put("queue", queue);
        }
        String spanId = startSpan(TASK_SPAN, tags);

        lock.lock();
        try {
            taskSpans.put(taskIdentifier, spanId);
        } finally {
            lock.unlock();
        }

        recordEvent(TASK_STARTED_EVENT, "Task " + taskName + " started", Map.of("task_id", taskIdentifier));
        return spanId;
    }

    public Optional<SpanRecord> completeTask(String taskId) {
        return completeTask(taskId, "success", null, null);
    }

    /**
     * Complete a task started with {@link #beginTask}. For an unknown task id this is
     * a no-op: nothing is recorded and empty is returned.
     *
     * @param result optional task result, tagged on the span in string form
     * @param error  when non-null the task is reported as failed
     */
    public Optional<SpanRecord> completeTask(String taskId, String status, Object result, String error) {
        String taskIdentifier = taskId != null ? taskId : UNKNOWN_TASK_ID;
        String normalizedStatus = (status != null ? status : "success").toLowerCase(Locale.ROOT);

        String spanId;
        lock.lock();
        try {
            spanId = taskSpans.remove(taskIdentifier);
        } finally {
            lock.unlock();
        }
        if (spanId == null) {
            return Optional.empty();
        }

        if (result != null) {
            addSpanTag(spanId, "result", result);
        }
        setSpanStatus(spanId, normalizedStatus);
        Optional<SpanRecord> completed = completeSpan(spanId, normalizedStatus, error);

        completed.ifPresent(record -> {
            String taskName = record.tags().getOrDefault("task_name", "unknown");
            recordMetric(TASK_RUNTIME_METRIC, record.durationMs(),
                    Map.of("task_name", taskName, "status", normalizedStatus));
            if (error != null) {
                recordEvent(TASK_FAILED_EVENT, "Task " + taskName + " failed", Severity.ERROR,
                        Map.of("task_id", taskIdentifier, "error", error));
            } else {
                recordEvent(TASK_COMPLETED_EVENT, "Task " + taskName + " completed",
                        Map.of("task_id", taskIdentifier, "status", normalizedStatus));
            }
        });
        return completed;
    }

    public Optional<SpanRecord> failTask(String taskId, Throwable exception) {
        Objects.requireNonNull(exception, "exception");
        return completeTask(taskId, "failure", null, Errors.describe(exception));
    }

    public int inFlightTaskCount() {
        lock.lock();
        try {
            return taskSpans.size();
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Drop all captured and in-flight state. Registered exporters are kept.
     */
    public void reset() {
        lock.lock();
        try {
            metrics.clear();
            events.clear();
            completedSpans.clear();
            activeSpans.clear();
            taskSpans.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register an exporter. Registering the same instance twice has no effect.
     */
    public void registerExporter(TelemetryExporter exporter) {
        if (exporter == null) {
            return;
        }
        lock.lock();
        try {
            for (TelemetryExporter existing : exporters) {
                if (existing == exporter) {
                    return;
                }
            }
            exporters.add(exporter);
        } finally {
            lock.unlock();
        }
        log.debug("Registered telemetry exporter {}", exporter);
    }

    public void clearExporters() {
        lock.lock();
        try {
            exporters.clear();
        } finally {
            lock.unlock();
        }
    }

    public List<TelemetryExporter> exporters() {
        lock.lock();
        try {
            return List.copyOf(exporters);
        } finally {
            lock.unlock();
        }
    }

    public Retention retention() {
        return retention;
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private <R> void notifyExporters(String hook, R record, BiConsumer<TelemetryExporter, R> call) {
        List<TelemetryExporter> targets = exporters();
        for (TelemetryExporter exporter : targets) {
            try {
                call.accept(exporter, record);
            } catch (Exception e) {
                log.warn("Telemetry exporter {} failed while handling {}", exporter, hook, e);
            }
        }
    }

    private static <R> void append(Deque<R> buffer, R record, int cap) {
        if (cap > 0) {
            while (buffer.size() >= cap) {
                buffer.pollFirst();
            }
        }
        buffer.addLast(record);
    }

    private <R> List<R> snapshot(Deque<R> buffer) {
        lock.lock();
        try {
            return List.copyOf(buffer);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static final class Builder {
        private Retention retention = Retention.UNBOUNDED;
        private Clock wallClock = Clock.systemUTC();
        private LongSupplier monotonicNanos = System::nanoTime;
        private Supplier<String> spanIds = IdGenerator.getInstance()::generateSpanId;
        private Supplier<String> taskIds = IdGenerator.getInstance()::generateTaskId;

        private Builder() {}

        public Builder retention(Retention retention) {
            this.retention = Objects.requireNonNull(retention, "retention");
            return this;
        }

        /** Wall clock for start/end timestamps. */
        public Builder wallClock(Clock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        /** Monotonic nanosecond source for durations. */
        public Builder monotonicNanos(LongSupplier monotonicNanos) {
            this.monotonicNanos = Objects.requireNonNull(monotonicNanos, "monotonicNanos");
            return this;
        }

        public Builder spanIds(Supplier<String> spanIds) {
            this.spanIds = Objects.requireNonNull(spanIds, "spanIds");
            return this;
        }

        public Builder taskIds(Supplier<String> taskIds) {
            this.taskIds = Objects.requireNonNull(taskIds, "taskIds");
            return this;
        }

        public ObservabilityClient build() {
            return new ObservabilityClient(this);
        }
    }
}
