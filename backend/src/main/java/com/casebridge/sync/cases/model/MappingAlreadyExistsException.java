package com.casebridge.sync.cases.model;

public class MappingAlreadyExistsException extends RuntimeException {

    private final String accountKey;
    private final String caseId;
    private final String existingConversationId;

    public MappingAlreadyExistsException(String accountKey, String caseId, String existingConversationId) {
        super("already_exists");
        this.accountKey = accountKey;
        this.caseId = caseId;
        this.existingConversationId = existingConversationId;
    }

    public String accountKey() {
        return accountKey;
    }

    public String caseId() {
        return caseId;
    }

    public String existingConversationId() {
        return existingConversationId;
    }
}
