package com.casebridge.sync.cases.model;

import java.time.Instant;

public record SupportCase(
        String accountKey,
        String caseId,
        String displayId,
        CaseStatus status,
        Instant statusAt,
        Instant lastCommunicationAt,
        long version
) {
}
