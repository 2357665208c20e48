package com.casebridge.sync.cases.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DedupKeysTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    @Test
    void same_bucket_yields_same_key() {
        var a = DedupKeys.forObservation("acct-0", "c-1", CaseStatus.RESOLVED, Instant.parse("2026-01-01T10:00:01Z"), WINDOW);
        var b = DedupKeys.forObservation("acct-0", "c-1", CaseStatus.RESOLVED, Instant.parse("2026-01-01T10:04:59Z"), WINDOW);
        assertEquals(a, b);
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]+"));
    }

    @Test
    void next_bucket_status_or_account_changes_key() {
        var base = DedupKeys.forObservation("acct-0", "c-1", CaseStatus.RESOLVED, Instant.parse("2026-01-01T10:00:00Z"), WINDOW);
        assertNotEquals(base, DedupKeys.forObservation("acct-0", "c-1", CaseStatus.RESOLVED, Instant.parse("2026-01-01T10:05:00Z"), WINDOW));
        assertNotEquals(base, DedupKeys.forObservation("acct-0", "c-1", CaseStatus.REOPENED, Instant.parse("2026-01-01T10:00:00Z"), WINDOW));
        assertNotEquals(base, DedupKeys.forObservation("acct-1", "c-1", CaseStatus.RESOLVED, Instant.parse("2026-01-01T10:00:00Z"), WINDOW));
    }
}
