package com.casebridge.sync.cases.service;

import com.casebridge.sync.backend.BackendCallException;
import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.cases.model.ForwardedReply;
import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.credential.CredentialBroker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Posts a chat participant's reply to the support case bound to the conversation.
 *
 * The body carries a "[From ... via Lark]" prefix, which is how {@link CommunicationRelayService} recognises the
 * reply when it comes back with the case's communications and skips it.
 */
@Service
public class ChatReplyService {

    private static final Logger log = LoggerFactory.getLogger(ChatReplyService.class);

    static final String DEFAULT_SENDER = "Team Member";
    static final int MAX_BODY_LENGTH = 8000;

    private final ConversationRepository conversationRepository;
    private final CredentialBroker credentialBroker;
    private final CaseBackend caseBackend;

    private final Counter forwarded;

    public ChatReplyService(
            ConversationRepository conversationRepository,
            CredentialBroker credentialBroker,
            CaseBackend caseBackend,
            MeterRegistry meterRegistry
    ) {
        this.conversationRepository = conversationRepository;
        this.credentialBroker = credentialBroker;
        this.caseBackend = caseBackend;

        this.forwarded = Counter.builder("casebridge.reply.forwarded")
                .description("Chat replies posted to their support case")
                .register(meterRegistry);
    }

    /**
     * @throws IllegalArgumentException {@code conversation_not_found}, {@code conversation_archived},
     *                                  {@code empty_reply} or {@code reply_too_long}
     * @throws BackendCallException when the backend refuses the reply or is unavailable
     */
    public ForwardedReply forward(String conversationId, String senderName, String text) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversation_not_found");
        }
        var content = text == null ? "" : text.strip();
        if (content.isEmpty()) {
            throw new IllegalArgumentException("empty_reply");
        }

        var conv = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));
        if (conv.archived()) {
            throw new IllegalArgumentException("conversation_archived");
        }

        var body = replyBody(senderName, content);
        if (body.length() > MAX_BODY_LENGTH) {
            throw new IllegalArgumentException("reply_too_long");
        }

        var lease = credentialBroker.getCredential(conv.accountKey());
        try {
            caseBackend.addCommunication(lease, conv.caseId(), body);
        } catch (BackendCallException e) {
            if (!e.credentialRejected()) throw e;
            credentialBroker.invalidate(conv.accountKey(), lease);
            caseBackend.addCommunication(credentialBroker.getCredential(conv.accountKey()), conv.caseId(), body);
        }

        forwarded.increment();
        log.info("chat_reply_forwarded conversationId={} account={} case={} length={}",
                conv.id(), conv.accountKey(), conv.caseId(), content.length());
        return new ForwardedReply(conv.id(), conv.accountKey(), conv.caseId(), body);
    }

    static String replyBody(String senderName, String text) {
        return "[From " + displayName(senderName) + " via Lark]\n\n" + text;
    }

    /**
     * Raw open ids ("ou_", "on_") are not shown to the support agent.
     */
    static String displayName(String senderName) {
        if (senderName == null) return DEFAULT_SENDER;
        var name = senderName.strip();
        if (name.isEmpty() || name.startsWith("ou_") || name.startsWith("on_")) return DEFAULT_SENDER;
        return name;
    }
}
