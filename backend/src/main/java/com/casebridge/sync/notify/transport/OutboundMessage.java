package com.casebridge.sync.notify.transport;

import com.casebridge.sync.notify.DispatchKind;

/**
 * One rendered dispatch. {@code dispatchId} is stable across retries so the transport can deduplicate.
 */
public record OutboundMessage(String dispatchId, String conversationId, DispatchKind kind, String text) {
}
