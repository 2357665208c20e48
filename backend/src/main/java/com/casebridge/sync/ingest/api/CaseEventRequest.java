package com.casebridge.sync.ingest.api;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code event_time} is ISO-8601 or epoch seconds; optional.
 */
public record CaseEventRequest(
        @NotBlank(message = "account_key_required") String account_key,
        @NotBlank(message = "case_id_required") String case_id,
        @NotBlank(message = "event_kind_required") String event_kind,
        String event_time
) {
}
