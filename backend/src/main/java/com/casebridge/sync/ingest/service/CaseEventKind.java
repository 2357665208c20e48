package com.casebridge.sync.ingest.service;

import com.casebridge.sync.cases.model.CaseStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * The push event kinds the backend emits. Plain status changes are not among them.
 */
public enum CaseEventKind {
    COMMUNICATION_ADDED("AddCommunicationToCase", null),
    CASE_RESOLVED("ResolveCase", CaseStatus.RESOLVED),
    CASE_REOPENED("ReopenCase", CaseStatus.REOPENED),
    CASE_CREATED("CreateCase", null);

    private final String upstreamName;
    private final CaseStatus impliedStatus;

    CaseEventKind(String upstreamName, CaseStatus impliedStatus) {
        this.upstreamName = upstreamName;
        this.impliedStatus = impliedStatus;
    }

    /**
     * Status this kind implies on its own; empty when the status has to be read from the backend.
     */
    public Optional<CaseStatus> impliedStatus() {
        return Optional.ofNullable(impliedStatus);
    }

    public static Optional<CaseEventKind> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        var value = raw.trim();
        for (var kind : values()) {
            if (kind.upstreamName.equals(value) || kind.name().equals(value.toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
