package com.pulse.telemetry.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Inbound request pipeline: a terminal handler wrapped by an interceptor chain.
 *
 * The pipeline does no network I/O; a server implementation decodes requests and
 * feeds them to {@link #handle}. Interceptors run in registration order, the
 * first registered being the outermost.
 *
 * Example usage:
 * <pre>
 * HttpPipeline pipeline = HttpPipeline.of(req -&gt; CompletableFuture.completedFuture(Response.ok("{}")))
 *     .intercept(new TracingInterceptor(client))
 *     .intercept(new ResponseTimeInterceptor(client, Duration.ofMillis(1500)));
 *
 * pipeline.handle(SimpleRequest.of(Method.GET, "/healthz")).join();
 * </pre>
 */
public final class HttpPipeline {

    private final Handler terminal;
    private final List<Interceptor> interceptors;

    private HttpPipeline(Handler terminal, List<Interceptor> interceptors) {
        this.terminal = terminal;
        this.interceptors = List.copyOf(interceptors);
    }

    public static HttpPipeline of(Handler terminal) {
        return new HttpPipeline(terminal, List.of());
    }

    /**
     * Build a pipeline from a handler and its interceptors, outermost first.
     */
    public static HttpPipeline chain(Handler terminal, Interceptor... interceptors) {
        return new HttpPipeline(terminal, List.of(interceptors));
    }

    /**
     * Add an interceptor to the chain. Returns a new pipeline.
     */
    public HttpPipeline intercept(Interceptor interceptor) {
        List<Interceptor> chain = new ArrayList<>(interceptors);
        chain.add(interceptor);
        return new HttpPipeline(terminal, chain);
    }

    public CompletableFuture<Response> handle(Request request) {
        Handler handler = terminal;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            Interceptor interceptor = interceptors.get(i);
            Handler next = handler;
            handler = req -> interceptor.intercept(req, next);
        }
        return handler.handle(request);
    }

    // ========================================================================
    // HTTP Method enum
    // ========================================================================

    public enum Method {
        GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS
    }

    // ========================================================================
    // Request
    // ========================================================================

    public interface Request {
        Method method();
        String path();
        Map<String, String> headers();
        byte[] body();

        /**
         * Case-insensitive header lookup.
         */
        default Optional<String> header(String name) {
            return headers().entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(name))
                    .map(Map.Entry::getValue)
                    .findFirst();
        }
    }

    // ========================================================================
    // Response
    // ========================================================================

    public interface Response {
        int status();
        Map<String, String> headers();
        byte[] body();

        /**
         * Copy of this response with the header set, unless already present.
         */
        Response withHeaderIfAbsent(String name, String value);

        static Response ok(String body) {
            return SimpleResponse.json(200, body);
        }

        static Response noContent() {
            return new SimpleResponse(204, Map.of(), new byte[0]);
        }

        static Response notFound() {
            return error(404, "Not Found");
        }

        static Response error(int status, String message) {
            return SimpleResponse.json(status, "{\"error\":\"" + message + "\"}");
        }

        static Response serverError(String message) {
            return error(500, message);
        }
    }

    // ========================================================================
    // Handler
    // ========================================================================

    @FunctionalInterface
    public interface Handler {
        CompletableFuture<Response> handle(Request request);

        /**
         * Create a synchronous handler.
         */
        static Handler sync(Function<Request, Response> fn) {
            return request -> CompletableFuture.completedFuture(fn.apply(request));
        }
    }

    // ========================================================================
    // Interceptor (Middleware)
    // ========================================================================

    @FunctionalInterface
    public interface Interceptor {
        /**
         * @param request The incoming request
         * @param next The next handler in the chain
         * @return The response (possibly modified)
         */
        CompletableFuture<Response> intercept(Request request, Handler next);
    }
}
