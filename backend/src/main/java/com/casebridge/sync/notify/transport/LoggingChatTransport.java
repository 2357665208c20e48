package com.casebridge.sync.notify.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no chat platform is configured: dispatches are only logged.
 */
public class LoggingChatTransport implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatTransport.class);

    @Override
    public void deliver(OutboundMessage message) {
        log.info("chat_dispatch_logged dispatchId={} conversationId={} kind={} text={}",
                message.dispatchId(), message.conversationId(), message.kind(), message.text());
    }
}
