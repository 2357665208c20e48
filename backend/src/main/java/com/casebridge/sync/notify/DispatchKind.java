package com.casebridge.sync.notify;

public enum DispatchKind {
    STATUS("st"),
    COMMUNICATION("cm"),
    WARN("wn"),
    ARCHIVE("ar");

    private final String idPrefix;

    DispatchKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
