package com.pulse.telemetry.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pulse.telemetry.base.Result;

/**
 * Jackson-backed {@link Codec} for records and plain beans.
 *
 * Instants are written as ISO-8601 strings. The shared {@link #mapper()} ignores
 * unknown properties on read.
 *
 * Usage:
 *   Codec<VerificationReport> codec = JsonCodec.forClass(VerificationReport.class).indented();
 *   Result<byte[]> bytes = codec.encode(report);
 */
public final class JsonCodec<A> implements Codec<A> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final Class<A> type;
    private final ObjectWriter writer;

    private JsonCodec(Class<A> type, ObjectWriter writer) {
        this.type = type;
        this.writer = writer;
    }

    public static <A> JsonCodec<A> forClass(Class<A> type) {
        return new JsonCodec<>(type, MAPPER.writerFor(type));
    }

    /**
     * Shared, fully configured mapper for ad-hoc tree reads.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Same codec writing human-oriented, indented output.
     */
    public JsonCodec<A> indented() {
        return new JsonCodec<>(type, writer.withDefaultPrettyPrinter());
    }

    @Override
    public Result<byte[]> encode(A value) {
        return Result.of(() -> writer.writeValueAsBytes(value));
    }
}
