package com.pulse.telemetry.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

import static com.pulse.telemetry.config.ConfigAccessor.bool;
import static com.pulse.telemetry.config.ConfigAccessor.duration;
import static com.pulse.telemetry.config.ConfigAccessor.intVal;
import static com.pulse.telemetry.config.ConfigAccessor.string;

/**
 * Type-safe access to telemetry configuration.
 *
 * Loads configuration from:
 * 1. reference.conf (defaults in JAR)
 * 2. application.conf (overrides, if present)
 * 3. Environment variables (highest priority, via ${?VAR} substitutions)
 *
 * Example usage:
 * <pre>
 *   TelemetryConfig config = TelemetryConfig.load();
 *
 *   int maxMetrics = config.retention().maxMetrics();
 *   boolean otel = config.openTelemetry().enabled();
 *   Duration slow = config.http().slowRequestThreshold();
 * </pre>
 *
 * Unlike a process-wide singleton, every call to {@link #load()} returns a fresh
 * instance; the startup code owns it and passes it where it is needed.
 */
public final class TelemetryConfig {

    private static final String ROOT = "telemetry";

    private final Config config;

    private TelemetryConfig(Config config) {
        this.config = config.getConfig(ROOT);
    }

    /**
     * Load configuration with standard resolution order.
     */
    public static TelemetryConfig load() {
        return new TelemetryConfig(ConfigFactory.load());
    }

    /**
     * Wrap an already resolved config; missing keys fall back to reference.conf.
     */
    public static TelemetryConfig fromConfig(Config config) {
        return new TelemetryConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    /**
     * Parse HOCON text (handy in tests); missing keys fall back to reference.conf.
     */
    public static TelemetryConfig parse(String hocon) {
        return fromConfig(ConfigFactory.parseString(hocon));
    }

    // ==========================================================================
    // Sections
    // ==========================================================================

    public RetentionConfig retention() {
        return new RetentionConfig(config.getConfig("retention"));
    }

    public OpenTelemetryConfig openTelemetry() {
        return new OpenTelemetryConfig(config.getConfig("exporters.opentelemetry"));
    }

    public int recentCapacity() {
        return intVal(config, "exporters.recent.capacity", 100);
    }

    public HttpConfig http() {
        return new HttpConfig(config.getConfig("http"));
    }

    public TasksConfig tasks() {
        return new TasksConfig(config.getConfig("tasks"));
    }

    // ==========================================================================
    // Nested Configuration Classes
    // ==========================================================================

    /**
     * Caps on the in-memory record buffers. Zero means unbounded.
     */
    public static final class RetentionConfig {
        private final Config config;

        RetentionConfig(Config config) {
            this.config = config;
        }

        public int maxMetrics() {
            return nonNegative("max-metrics");
        }

        public int maxEvents() {
            return nonNegative("max-events");
        }

        public int maxSpans() {
            return nonNegative("max-spans");
        }

        private int nonNegative(String path) {
            int value = intVal(config, path, 0);
            if (value < 0) {
                throw new IllegalArgumentException("telemetry.retention." + path + " must be >= 0, got " + value);
            }
            return value;
        }
    }

    public static final class OpenTelemetryConfig {
        private final Config config;

        OpenTelemetryConfig(Config config) {
            this.config = config;
        }

        public boolean enabled() {
            return bool(config, "enabled", true);
        }

        public String instrumentationScope() {
            return string(config, "instrumentation-scope", "pulse-telemetry");
        }
    }

    public static final class HttpConfig {
        private final Config config;

        HttpConfig(Config config) {
            this.config = config;
        }

        public Duration slowRequestThreshold() {
            return duration(config, "slow-request-threshold", Duration.ofMillis(1500));
        }
    }

    public static final class TasksConfig {
        private final Config config;

        TasksConfig(Config config) {
            this.config = config;
        }

        public int workers() {
            return Math.max(1, intVal(config, "workers", Runtime.getRuntime().availableProcessors()));
        }

        public String defaultQueue() {
            return string(config, "default-queue", "default");
        }
    }
}
