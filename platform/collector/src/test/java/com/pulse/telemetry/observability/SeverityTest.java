package com.pulse.telemetry.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SeverityTest {

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(Severity.WARNING, Severity.parse("Warning"));
        assertEquals(Severity.WARNING, Severity.parse("warn"));
        assertEquals(Severity.ERROR, Severity.parse(" ERROR "));
        assertEquals(Severity.CRITICAL, Severity.parse("critical"));
        assertEquals(Severity.INFO, Severity.parse("info"));
    }

    @Test
    void unknownOrMissingIsInfo() {
        assertEquals(Severity.INFO, Severity.parse(null));
        assertEquals(Severity.INFO, Severity.parse(""));
        assertEquals(Severity.INFO, Severity.parse("debug"));
    }

    @Test
    void onlyErrorAndCriticalAreErrors() {
        assertFalse(Severity.INFO.isError());
        assertFalse(Severity.WARNING.isError());
        assertTrue(Severity.ERROR.isError());
        assertTrue(Severity.CRITICAL.isError());
        assertEquals("critical", Severity.CRITICAL.label());
    }
}
