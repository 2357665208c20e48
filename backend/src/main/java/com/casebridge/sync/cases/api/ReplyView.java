package com.casebridge.sync.cases.api;

import com.casebridge.sync.cases.model.ForwardedReply;

public record ReplyView(
        String conversation_id,
        String account_key,
        String case_id,
        String body
) {

    public static ReplyView of(ForwardedReply reply) {
        return new ReplyView(reply.conversationId(), reply.accountKey(), reply.caseId(), reply.body());
    }
}
