package com.pulse.telemetry.base;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultTest {

    @Test
    void ofCapturesValue() {
        Result<Integer> result = Result.of(() -> 42);

        assertTrue(result.isSuccess());
        assertEquals(42, result.getOrThrow());
        assertTrue(result.error().isEmpty());
    }

    @Test
    void ofCapturesCheckedException() {
        IOException boom = new IOException("disk gone");
        Result<Integer> result = Result.of(() -> {
            throw boom;
        });

        assertTrue(result.isFailure());
        assertSame(boom, result.error().orElseThrow());
        assertEquals(7, result.getOrElse(7));
        assertTrue(result.toOptional().isEmpty());
    }

    @Test
    void getOrThrowOnFailureThrows() {
        Result<String> result = Result.failure("nope");

        RuntimeException thrown = assertThrows(RuntimeException.class, result::getOrThrow);
        assertTrue(thrown.getMessage().contains("nope"));
    }

    @Test
    void mapAndFold() {
        Result<Integer> doubled = Result.success(21).map(x -> x * 2);
        assertEquals("42", doubled.fold(e -> "failed", String::valueOf));

        Result<Integer> failed = Result.<Integer>failure("bad").map(x -> x * 2);
        assertEquals("failed", failed.fold(e -> "failed", String::valueOf));
    }

    @Test
    void callbacksRunOnlyOnMatchingBranch() {
        List<String> seen = new ArrayList<>();

        Result.success("a").onSuccess(seen::add).onFailure(e -> seen.add("error"));
        Result.<String>failure("b").onSuccess(seen::add).onFailure(e -> seen.add("error"));

        assertEquals(List.of("a", "error"), seen);
    }

    @Test
    void runReturnsUnit() {
        assertSame(Unit.VALUE, Result.run(() -> {}).getOrThrow());
        assertTrue(Result.run(() -> {
            throw new IllegalStateException("x");
        }).isFailure());
    }
}
