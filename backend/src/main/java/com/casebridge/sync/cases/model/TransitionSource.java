package com.casebridge.sync.cases.model;

public enum TransitionSource {
    PUSH,
    POLL
}
