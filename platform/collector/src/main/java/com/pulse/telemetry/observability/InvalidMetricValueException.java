package com.pulse.telemetry.observability;

/**
 * Thrown by {@link ObservabilityClient#recordMetric} when the value is not numeric.
 * The only error the collector raises to its callers.
 */
public class InvalidMetricValueException extends IllegalArgumentException {

    private final transient Object rejectedValue;

    public InvalidMetricValueException(String metricName, Object rejectedValue) {
        super(String.format("Metric value must be numeric, got %s for metric '%s'",
                rejectedValue == null ? "null" : rejectedValue.getClass().getName(), metricName));
        this.rejectedValue = rejectedValue;
    }

    public Object rejectedValue() {
        return rejectedValue;
    }
}
