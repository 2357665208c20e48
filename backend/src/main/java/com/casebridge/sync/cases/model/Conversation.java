package com.casebridge.sync.cases.model;

import java.time.Instant;

public record Conversation(
        String id,
        String accountKey,
        String caseId,
        String creatorId,
        Instant createdAt,
        Instant resolvedAt,
        Instant warnedAt,
        boolean archived,
        Instant archivedAt,
        String archiveReason
) {

    public static String liveCaseKey(String accountKey, String caseId) {
        return accountKey + "|" + caseId;
    }
}
