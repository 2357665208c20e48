package com.casebridge.sync.cases.model;

/**
 * A conversation together with the case it mirrors.
 */
public record CaseMapping(SupportCase supportCase, Conversation conversation) {
}
