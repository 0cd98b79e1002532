package com.pulse.telemetry.http;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable {@link HttpPipeline.Response}. Header additions return a copy.
 */
public record SimpleResponse(int status, Map<String, String> headers, byte[] body) implements HttpPipeline.Response {

    public SimpleResponse {
        headers = Map.copyOf(headers);
        body = body != null ? body : new byte[0];
    }

    /**
     * JSON response with Content-Type and Content-Length set from the body.
     */
    static SimpleResponse json(int status, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new SimpleResponse(status, Map.of(
                "Content-Type", "application/json",
                "Content-Length", Integer.toString(bytes.length)), bytes);
    }

    @Override
    public HttpPipeline.Response withHeaderIfAbsent(String name, String value) {
        if (headers.containsKey(name)) {
            return this;
        }
        Map<String, String> extended = new LinkedHashMap<>(headers);
        extended.put(name, value);
        return new SimpleResponse(status, extended, body);
    }
}
