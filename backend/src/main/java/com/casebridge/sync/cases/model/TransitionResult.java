package com.casebridge.sync.cases.model;

/**
 * Result of {@code applyTransition}.
 *
 * @param before     recorded status when the observation was evaluated, null for DUPLICATE_IGNORED and NOT_FOUND
 * @param changed    true only when an APPLIED transition actually moved the case status
 * @param dispatchId identity of the outbound notification enqueued for this transition, null when none was
 */
public record TransitionResult(
        TransitionOutcome outcome,
        String accountKey,
        String caseId,
        CaseStatus before,
        CaseStatus observed,
        boolean changed,
        String dedupKey,
        String conversationId,
        String dispatchId
) {

    public static TransitionResult notFound(String accountKey, String caseId, CaseStatus observed, String dedupKey) {
        return new TransitionResult(TransitionOutcome.NOT_FOUND, accountKey, caseId, null, observed, false, dedupKey, null, null);
    }

    public static TransitionResult duplicate(String accountKey, String caseId, CaseStatus observed, String dedupKey) {
        return new TransitionResult(TransitionOutcome.DUPLICATE_IGNORED, accountKey, caseId, null, observed, false, dedupKey, null, null);
    }

    /**
     * Case status once this result is in effect.
     */
    public CaseStatus after() {
        return changed ? observed : before;
    }

    public boolean applied() {
        return outcome == TransitionOutcome.APPLIED;
    }
}
