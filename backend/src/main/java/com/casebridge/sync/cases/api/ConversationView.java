package com.casebridge.sync.cases.api;

import com.casebridge.sync.cases.model.Conversation;
import com.casebridge.sync.cases.model.SupportCase;

import java.time.Instant;

/**
 * Timestamps are epoch seconds. Case fields are null when only the conversation is known.
 */
public record ConversationView(
        String conversation_id,
        String account_key,
        String case_id,
        String display_id,
        String case_status,
        String creator_id,
        long created_at,
        Long resolved_at,
        Long warned_at,
        boolean archived,
        Long archived_at,
        String archive_reason
) {

    public static ConversationView of(Conversation conv, SupportCase supportCase) {
        return new ConversationView(
                conv.id(),
                conv.accountKey(),
                conv.caseId(),
                supportCase == null ? null : supportCase.displayId(),
                supportCase == null ? null : supportCase.status().name(),
                conv.creatorId(),
                conv.createdAt().getEpochSecond(),
                epoch(conv.resolvedAt()),
                epoch(conv.warnedAt()),
                conv.archived(),
                epoch(conv.archivedAt()),
                conv.archiveReason()
        );
    }

    private static Long epoch(Instant instant) {
        return instant == null ? null : instant.getEpochSecond();
    }
}
