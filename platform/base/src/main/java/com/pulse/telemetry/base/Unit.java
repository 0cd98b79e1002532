package com.pulse.telemetry.base;

/**
 * The single "nothing to return" value, for {@code Result<Unit>} steps that
 * either happen or fail.
 */
public enum Unit {
    VALUE;

    @Override
    public String toString() {
        return "()";
    }
}
