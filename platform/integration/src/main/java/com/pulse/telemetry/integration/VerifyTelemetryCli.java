package com.pulse.telemetry.integration;

import com.pulse.telemetry.base.Result;
import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.observability.Errors;
import com.pulse.telemetry.observability.ObservabilityClient;
import com.pulse.telemetry.observability.SpanRecord;
import com.pulse.telemetry.observability.Telemetry;
import com.pulse.telemetry.serialization.JsonCodec;
import com.pulse.telemetry.tasks.TaskExecutor;
import com.pulse.telemetry.tasks.TaskInstrumentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Verifies cache, task and telemetry wiring in one pass.
 *
 * Usage:
 *   java -cp ... com.pulse.telemetry.integration.VerifyTelemetryCli [options]
 *
 * Options:
 *   --json       Print the summary as JSON
 *   --help, -h   Show this help
 *
 * Reports status only: the exit code is 0 even when the cache or the task fails.
 */
public class VerifyTelemetryCli {

    private static final Logger log = LoggerFactory.getLogger(VerifyTelemetryCli.class);

    static final String CACHE_KEY = "observability:verification";
    static final String CACHE_METRIC = "cache.roundtrip";
    static final String CHECK_EVENT = "observability.check";
    static final String VERIFICATION_TASK = "verification.ping";

    private final ObservabilityClient client;
    private final CacheBackend cache;
    private final TelemetryConfig.TasksConfig tasksConfig;
    private final VerificationTask task;

    /**
     * Body of the task executed end-to-end.
     */
    @FunctionalInterface
    public interface VerificationTask {
        String run() throws Exception;
    }

    public VerifyTelemetryCli(ObservabilityClient client, CacheBackend cache, TelemetryConfig.TasksConfig tasksConfig) {
        this(client, cache, tasksConfig, () -> "Test task completed successfully");
    }

    VerifyTelemetryCli(ObservabilityClient client, CacheBackend cache, TelemetryConfig.TasksConfig tasksConfig,
                       VerificationTask task) {
        this.client = client;
        this.cache = cache;
        this.tasksConfig = tasksConfig;
        this.task = task;
    }

    public static void main(String[] args) {
        TelemetryConfig config = TelemetryConfig.load();
        Telemetry telemetry = Telemetry.bootstrap(config);
        VerifyTelemetryCli cli = new VerifyTelemetryCli(
                telemetry.client(), CacheBackend.caffeine(Duration.ofSeconds(30)), config.tasks());
        System.exit(cli.run(args, System.out));
    }

    /**
     * @return process exit code
     */
    public int run(String[] args, PrintStream out) {
        boolean json = false;
        for (String arg : args) {
            switch (arg) {
                case "--json" -> json = true;
                case "--help", "-h" -> {
                    printUsage(out);
                    return 0;
                }
                default -> {
                    out.println("Unknown option: " + arg);
                    printUsage(out);
                    return 1;
                }
            }
        }

        VerificationReport report = verify(out);
        if (json) {
            printJson(report, out);
        } else {
            printSummary(report, out);
        }
        return 0;
    }

    // ========================================================================
    // Verification steps
    // ========================================================================

    VerificationReport verify(PrintStream out) {
        client.reset();

        out.println("Checking cache backend roundtrip ...");
        boolean cacheHit = cacheRoundTrip();
        client.recordMetric(CACHE_METRIC, 1, Map.of(
                "backend", cache.name(),
                "result", cacheHit ? "hit" : "miss"));
        out.printf("Cache roundtrip %s using %s%n", cacheHit ? "succeeded" : "failed", cache.name());

        out.println("Executing test task via in-process runner ...");
        Result<String> taskResult = runTask();
        taskResult
                .onSuccess(value -> out.println("Test task completed with result: " + value))
                .onFailure(e -> out.println("Test task failed: " + Errors.describe(e)));

        client.recordEvent(CHECK_EVENT, "Observability verification completed", Map.of(
                "metrics", String.valueOf(client.getMetrics().size()),
                "spans", String.valueOf(client.getCompletedSpans().size())));

        List<SpanRecord> spans = client.getCompletedSpans();
        return new VerificationReport(
                cache.name(),
                cacheHit,
                taskResult.isSuccess(),
                taskResult.fold(Errors::describe, value -> value),
                spans.size(),
                client.getMetrics().size(),
                client.getEvents().size(),
                spans.stream()
                        .map(s -> new VerificationReport.SpanLine(
                                s.tags().getOrDefault("task_name", s.name()), s.status(), s.durationMs()))
                        .toList());
    }

    private boolean cacheRoundTrip() {
        return Result.of(() -> {
                    cache.put(CACHE_KEY, "ok");
                    return cache.get(CACHE_KEY).map("ok"::equals).orElse(false);
                })
                .onFailure(e -> log.warn("Cache roundtrip against {} failed", cache.name(), e))
                .getOrElse(false);
    }

    private Result<String> runTask() {
        try (TaskExecutor executor = TaskExecutor.create(tasksConfig, new TaskInstrumentation(client))) {
            return Result.of(() -> executor.apply(VERIFICATION_TASK, null, task::run));
        }
    }

    // ========================================================================
    // Output
    // ========================================================================

    private static void printSummary(VerificationReport report, PrintStream out) {
        out.println();
        out.println("Captured instrumentation summary:");
        out.printf("  * %d spans%n", report.spanCount());
        out.printf("  * %d metrics%n", report.metricCount());
        out.printf("  * %d events%n", report.eventCount());
        for (VerificationReport.SpanLine span : report.spans()) {
            out.printf(Locale.ROOT, "    - span=%s status=%s duration=%.2fms%n", span.name(), span.status(), span.durationMs());
        }
    }

    private static void printJson(VerificationReport report, PrintStream out) {
        JsonCodec.forClass(VerificationReport.class).indented()
                .encode(report)
                .onSuccess(bytes -> out.println(new String(bytes, StandardCharsets.UTF_8)))
                .onFailure(e -> {
                    log.warn("Could not encode verification report as JSON", e);
                    printSummary(report, out);
                });
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: VerifyTelemetryCli [--json] [--help]");
        out.println();
        out.println("Runs a cache roundtrip and one instrumented task, then prints captured telemetry.");
        out.println();
        out.println("Options:");
        out.println("  --json       Print the summary as JSON");
        out.println("  --help, -h   Show this help");
    }
}
