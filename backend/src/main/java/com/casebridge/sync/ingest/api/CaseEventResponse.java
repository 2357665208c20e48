package com.casebridge.sync.ingest.api;

public record CaseEventResponse(
        String outcome,
        String status_before,
        String status_after,
        boolean changed,
        String conversation_id,
        int communications_relayed
) {
}
