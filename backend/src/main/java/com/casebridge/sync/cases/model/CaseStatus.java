package com.casebridge.sync.cases.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical case status. Backend-specific statuses collapse into these four values.
 */
public enum CaseStatus {
    OPEN,
    PENDING,
    RESOLVED,
    REOPENED;

    private static final Map<CaseStatus, Set<CaseStatus>> LEGAL_EDGES = Map.of(
            OPEN, EnumSet.of(PENDING, RESOLVED),
            PENDING, EnumSet.of(RESOLVED),
            RESOLVED, EnumSet.of(REOPENED),
            REOPENED, EnumSet.of(OPEN, PENDING, RESOLVED)
    );

    private static final Map<String, CaseStatus> BACKEND_STATUSES = Map.of(
            "opened", OPEN,
            "unassigned", OPEN,
            "work-in-progress", OPEN,
            "customer-action-completed", OPEN,
            "amazon-action-completed", OPEN,
            "pending-customer-action", PENDING,
            "pending-amazon-action", PENDING,
            "resolved", RESOLVED,
            "reopened", REOPENED
    );

    /**
     * Whether {@code this -> next} is a legal status change. Same-status observations are not edges.
     */
    public boolean canTransitionTo(CaseStatus next) {
        if (next == null) return false;
        return LEGAL_EDGES.get(this).contains(next);
    }

    public boolean isResolved() {
        return this == RESOLVED;
    }

    /**
     * Collapses a backend status string. Unknown or missing values read as OPEN.
     */
    public static CaseStatus fromBackend(String backendStatus) {
        if (backendStatus == null) return OPEN;
        var normalized = backendStatus.trim().toLowerCase(Locale.ROOT);
        var mapped = BACKEND_STATUSES.get(normalized);
        if (mapped != null) return mapped;
        for (var s : values()) {
            if (s.name().equalsIgnoreCase(normalized)) return s;
        }
        return OPEN;
    }

    public static CaseStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("invalid_status");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid_status");
        }
    }
}
