package com.casebridge.sync.backend;

import com.casebridge.sync.cases.model.CaseStatus;

import java.util.List;

/**
 * Authoritative case snapshot as read from the ticketing backend.
 */
public record RemoteCase(
        String caseId,
        String displayId,
        String backendStatus,
        CaseStatus status,
        List<RemoteCommunication> communications
) {
    public RemoteCase {
        communications = communications == null ? List.of() : List.copyOf(communications);
    }
}
