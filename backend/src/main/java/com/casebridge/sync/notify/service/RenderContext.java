package com.casebridge.sync.notify.service;

/**
 * What a renderer knows about the case behind a conversation.
 */
public record RenderContext(String accountKey, String caseId, String displayId) {

    public String caseLabel() {
        return displayId == null || displayId.isBlank() ? caseId : displayId;
    }
}
