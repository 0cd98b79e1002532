package com.pulse.telemetry.observability;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric coercion for metric values.
 *
 * Booleans map to 1.0/0.0; integral, floating-point and decimal boxes convert
 * to double. Everything else is rejected.
 */
final class MetricValues {

    private MetricValues() {}

    static double coerce(String metricName, Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Double || value instanceof Float
                || value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger integer) {
            return integer.doubleValue();
        }
        throw new InvalidMetricValueException(metricName, value);
    }
}
