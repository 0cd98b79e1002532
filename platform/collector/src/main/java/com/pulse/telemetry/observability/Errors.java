package com.pulse.telemetry.observability;

/**
 * String form of a throwable as stored on spans and events.
 */
public final class Errors {

    private Errors() {}

    /**
     * The message when present, otherwise {@code Throwable.toString()}.
     */
    public static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null ? message : t.toString();
    }
}
