package com.casebridge.sync.notify.transport;

/**
 * Delivery side of the chat platform.
 */
public interface ChatTransport {

    /**
     * Delivers {@code message} to its conversation. ARCHIVE messages also close the conversation on the chat side.
     *
     * @throws ChatTransportException when delivery failed and should be retried
     */
    void deliver(OutboundMessage message);
}
