package com.pulse.telemetry.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.function.BiFunction;

/**
 * Defaulting reads over a {@link Config} section: a missing path yields the
 * supplied default, a present path with the wrong type still fails loudly.
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    public static String string(Config c, String path, String defaultValue) {
        return read(c, path, defaultValue, Config::getString);
    }

    public static int intVal(Config c, String path, int defaultValue) {
        return read(c, path, defaultValue, Config::getInt);
    }

    public static boolean bool(Config c, String path, boolean defaultValue) {
        return read(c, path, defaultValue, Config::getBoolean);
    }

    public static Duration duration(Config c, String path, Duration defaultValue) {
        return read(c, path, defaultValue, Config::getDuration);
    }

    private static <T> T read(Config c, String path, T defaultValue, BiFunction<Config, String, T> getter) {
        return c.hasPath(path) ? getter.apply(c, path) : defaultValue;
    }
}
