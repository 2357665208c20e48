package com.casebridge.sync.cases.model;

public enum TransitionOutcome {
    APPLIED,
    DUPLICATE_IGNORED,
    REJECTED_INVALID_EDGE,
    NOT_FOUND
}
