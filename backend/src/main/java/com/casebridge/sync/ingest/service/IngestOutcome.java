package com.casebridge.sync.ingest.service;

import com.casebridge.sync.cases.model.TransitionResult;

/**
 * @param outcome the transition outcome name, or IGNORED for unknown and informational events
 */
public record IngestOutcome(String outcome, TransitionResult transition, int communicationsRelayed) {

    public static final String IGNORED = "IGNORED";

    public static IngestOutcome ignored() {
        return new IngestOutcome(IGNORED, null, 0);
    }

    public static IngestOutcome of(TransitionResult transition, int communicationsRelayed) {
        return new IngestOutcome(transition.outcome().name(), transition, communicationsRelayed);
    }
}
