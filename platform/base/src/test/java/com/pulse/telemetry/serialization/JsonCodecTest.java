package com.pulse.telemetry.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulse.telemetry.base.Result;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonCodecTest {

    public record Snapshot(String name, Instant at, List<String> tags) {}

    @Test
    void instantsAreWrittenAsIsoStrings() {
        Snapshot snapshot = new Snapshot("check", Instant.parse("2024-03-01T10:15:30Z"), List.of("a"));

        String json = new String(JsonCodec.forClass(Snapshot.class).encode(snapshot).getOrThrow(),
                StandardCharsets.UTF_8);

        assertTrue(json.contains("\"at\":\"2024-03-01T10:15:30Z\""), json);
        assertTrue(json.contains("\"name\":\"check\""), json);
    }

    @Test
    void indentedOutputSpansLines() {
        Snapshot snapshot = new Snapshot("check", Instant.parse("2024-03-01T10:15:30Z"), List.of());

        String json = new String(JsonCodec.forClass(Snapshot.class).indented().encode(snapshot).getOrThrow(),
                StandardCharsets.UTF_8);

        assertTrue(json.contains("\n"), json);
        assertTrue(json.contains("\"name\" : \"check\""), json);
    }

    @Test
    void sharedMapperIgnoresUnknownProperties() throws Exception {
        byte[] json = "{\"name\":\"n\",\"at\":\"2024-03-01T10:15:30Z\",\"tags\":[],\"extra\":1}"
                .getBytes(StandardCharsets.UTF_8);

        Snapshot decoded = JsonCodec.mapper().readValue(json, Snapshot.class);
        JsonNode tree = JsonCodec.mapper().readTree(json);

        assertEquals("n", decoded.name());
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), decoded.at());
        assertEquals(1, tree.get("extra").asInt());
    }

    @Test
    void unencodableValueIsAFailure() {
        Result<byte[]> result = JsonCodec.forClass(Object.class).encode(new Object());

        assertTrue(result.isFailure());
        assertTrue(result.error().isPresent());
    }
}
