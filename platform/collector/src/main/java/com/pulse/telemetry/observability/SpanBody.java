package com.pulse.telemetry.observability;

/**
 * Work executed inside a span by {@link ObservabilityClient#inSpan}.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw
 */
@FunctionalInterface
public interface SpanBody<T, E extends Exception> {
    T apply(SpanHandle span) throws E;
}
