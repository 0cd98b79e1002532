package com.pulse.telemetry.base;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a fallible step: a value, or the throwable that prevented it.
 *
 * Used wherever a failure must be reported without being thrown at the caller:
 * exporter wiring at bootstrap, cache probes, JSON encoding.
 *
 * <pre>{@code
 * Result<Unit> wired = DefaultExporters.register(client, config, GlobalOpenTelemetry::get);
 * wired.onFailure(e -> log.warn("running without forwarding", e));
 * }</pre>
 *
 * @param <A> value type; never null inside a {@link Success}
 */
public sealed interface Result<A> permits Result.Success, Result.Failure {

    static <A> Result<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Result<A> failure(Throwable error) {
        return new Failure<>(error);
    }

    static <A> Result<A> failure(String message) {
        return failure(new IllegalStateException(message));
    }

    /**
     * Evaluate {@code supplier}, capturing anything it throws.
     */
    static <A> Result<A> of(ThrowingSupplier<A> supplier) {
        try {
            return success(supplier.get());
        } catch (Throwable t) {
            return failure(t);
        }
    }

    static Result<Unit> run(ThrowingRunnable action) {
        return of(() -> {
            action.run();
            return Unit.VALUE;
        });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default Optional<A> toOptional() {
        return this instanceof Success<A> s ? Optional.of(s.value()) : Optional.empty();
    }

    default Optional<Throwable> error() {
        return this instanceof Failure<A> f ? Optional.of(f.cause()) : Optional.empty();
    }

    default A getOrElse(A fallback) {
        return toOptional().orElse(fallback);
    }

    /**
     * The value, or the failure rethrown. Checked causes are wrapped in
     * {@link IllegalStateException}.
     */
    default A getOrThrow() {
        if (this instanceof Success<A> s) {
            return s.value();
        }
        Throwable cause = ((Failure<A>) this).cause();
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error e) {
            throw e;
        }
        throw new IllegalStateException(cause.getMessage(), cause);
    }

    // ========================================================================
    // Combinators
    // ========================================================================

    /**
     * Transform the value; an exception thrown by {@code f} becomes a failure.
     */
    default <B> Result<B> map(Function<A, B> f) {
        if (this instanceof Success<A> s) {
            return of(() -> f.apply(s.value()));
        }
        return failure(((Failure<A>) this).cause());
    }

    default <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess) {
        return this instanceof Success<A> s
                ? onSuccess.apply(s.value())
                : onFailure.apply(((Failure<A>) this).cause());
    }

    default Result<A> onSuccess(Consumer<A> action) {
        if (this instanceof Success<A> s) {
            action.accept(s.value());
        }
        return this;
    }

    default Result<A> onFailure(Consumer<Throwable> action) {
        if (this instanceof Failure<A> f) {
            action.accept(f.cause());
        }
        return this;
    }

    // ========================================================================
    // Cases
    // ========================================================================

    record Success<A>(A value) implements Result<A> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<A>(Throwable cause) implements Result<A> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<A> {
        A get() throws Exception;
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
