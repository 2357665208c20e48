package com.casebridge.sync.ingest.service;

import java.time.Instant;

/**
 * One push-delivered lifecycle event. {@code eventTime} may be null when the transport did not stamp it.
 */
public record CaseEvent(String accountKey, String caseId, String eventKind, Instant eventTime) {
}
