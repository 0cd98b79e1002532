package com.pulse.telemetry.id;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free source of process-unique span and task ids.
 *
 * An id packs 128 bits: the upper half holds milliseconds since 2024-01-01
 * (48 bits) and a per-process node tag (16 bits, pid mixed with random bits);
 * the lower half is a sequence shared by every id this process produces. The
 * sequence never resets, so ids stay unique even if the wall clock steps back.
 *
 * Span ids are written as 32 lowercase hex digits, the shape OpenTelemetry uses
 * for trace ids. Task ids carry the same bits in the 8-4-4-4-12 form task
 * queues usually expect.
 */
public final class IdGenerator {

    private static final long EPOCH_MILLIS = 1_704_067_200_000L;

    private static final IdGenerator INSTANCE = new IdGenerator();

    private final long nodeTag;
    private final AtomicLong sequence = new AtomicLong();

    private IdGenerator() {
        long pid = ProcessHandle.current().pid();
        this.nodeTag = (pid ^ new SecureRandom().nextInt()) & 0xFFFFL;
    }

    public static IdGenerator getInstance() {
        return INSTANCE;
    }

    public String generateSpanId() {
        long high = nextHigh();
        long low = sequence.incrementAndGet();
        StringBuilder id = new StringBuilder(32);
        appendHex(id, high, 16);
        appendHex(id, low, 16);
        return id.toString();
    }

    public String generateTaskId() {
        long high = nextHigh();
        long low = sequence.incrementAndGet();
        StringBuilder id = new StringBuilder(36);
        appendHex(id, high >>> 32, 8).append('-');
        appendHex(id, high >>> 16, 4).append('-');
        appendHex(id, high, 4).append('-');
        appendHex(id, low >>> 48, 4).append('-');
        appendHex(id, low, 12);
        return id.toString();
    }

    private long nextHigh() {
        long millis = (System.currentTimeMillis() - EPOCH_MILLIS) & 0xFFFF_FFFF_FFFFL;
        return (millis << 16) | nodeTag;
    }

    /** Append the low {@code digits} nibbles of {@code value}, most significant first. */
    private static StringBuilder appendHex(StringBuilder out, long value, int digits) {
        for (int shift = (digits - 1) * 4; shift >= 0; shift -= 4) {
            out.append(Character.forDigit((int) ((value >>> shift) & 0xF), 16));
        }
        return out;
    }
}
