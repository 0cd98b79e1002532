package com.pulse.telemetry.http;

import java.util.Map;

/**
 * Simple immutable Request implementation.
 */
public record SimpleRequest(
    HttpPipeline.Method method,
    String path,
    Map<String, String> headers,
    byte[] body
) implements HttpPipeline.Request {

    public SimpleRequest {
        headers = Map.copyOf(headers);
        body = body != null ? body : new byte[0];
    }

    public static SimpleRequest of(HttpPipeline.Method method, String path) {
        return new SimpleRequest(method, path, Map.of(), new byte[0]);
    }
}
