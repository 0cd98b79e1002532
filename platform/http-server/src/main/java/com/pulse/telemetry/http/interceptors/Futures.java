package com.pulse.telemetry.http.interceptors;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

    private Futures() {}

    /**
     * The original failure behind CompletableFuture wrapping.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static CompletionException asCompletion(Throwable error) {
        return error instanceof CompletionException ce ? ce : new CompletionException(error);
    }
}
