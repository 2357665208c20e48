package com.casebridge.sync.cases.model;

public record ForwardedReply(
        String conversationId,
        String accountKey,
        String caseId,
        String body
) {
}
