package com.aerocharts.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChartFailureKindTest {

    @Test
    void http_status_mapping() {
        assertNull(ChartFailureKind.fromHttpStatus(200));
        assertNull(ChartFailureKind.fromHttpStatus(302));
        assertEquals(ChartFailureKind.ACCESS_RESTRICTED, ChartFailureKind.fromHttpStatus(401));
        assertEquals(ChartFailureKind.ACCESS_RESTRICTED, ChartFailureKind.fromHttpStatus(403));
        assertEquals(ChartFailureKind.NOT_FOUND, ChartFailureKind.fromHttpStatus(404));
        assertEquals(ChartFailureKind.NOT_FOUND, ChartFailureKind.fromHttpStatus(410));
        assertEquals(ChartFailureKind.UPSTREAM_UNAVAILABLE, ChartFailureKind.fromHttpStatus(429));
        assertEquals(ChartFailureKind.UPSTREAM_UNAVAILABLE, ChartFailureKind.fromHttpStatus(503));
        assertEquals(ChartFailureKind.UPSTREAM_UNAVAILABLE, ChartFailureKind.fromHttpStatus(-1));
        assertEquals(ChartFailureKind.PARSE_MISMATCH, ChartFailureKind.fromHttpStatus(400));
    }

    @Test
    void only_transient_kinds_are_retryable() {
        assertTrue(ChartFailureKind.UPSTREAM_UNAVAILABLE.isRetryable());
        assertTrue(ChartFailureKind.BACKEND_TIMEOUT.isRetryable());
        assertTrue(ChartFailureKind.VERSION_UNRESOLVED.isRetryable());
        assertFalse(ChartFailureKind.UNKNOWN_SOURCE.isRetryable());
        assertFalse(ChartFailureKind.NOT_FOUND.isRetryable());
        assertFalse(ChartFailureKind.PARSE_MISMATCH.isRetryable());
        assertFalse(ChartFailureKind.ACCESS_RESTRICTED.isRetryable());
    }

    @Test
    void user_messages_are_distinct() {
        assertNotEquals(ChartFailureKind.UNKNOWN_SOURCE.summary(), ChartFailureKind.UPSTREAM_UNAVAILABLE.summary());
        assertNotEquals(ChartFailureKind.NOT_FOUND.summary(), ChartFailureKind.UNKNOWN_SOURCE.summary());
    }

    @Test
    void with_context_keeps_kind_and_cause() {
        ChartSourceException e = new ChartSourceException(ChartFailureKind.NOT_FOUND, "gone");
        ChartSourceException c = e.withContext("spain", "LEMD");
        assertEquals(ChartFailureKind.NOT_FOUND, c.kind());
        assertEquals("spain", c.sourceId());
        assertEquals("LEMD", c.identifier());
        assertEquals("gone", c.getMessage());
    }
}
