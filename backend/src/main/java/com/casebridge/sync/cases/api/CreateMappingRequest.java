package com.casebridge.sync.cases.api;

import jakarta.validation.constraints.NotBlank;

public record CreateMappingRequest(
        @NotBlank(message = "account_key_required") String account_key,
        @NotBlank(message = "case_id_required") String case_id,
        @NotBlank(message = "conversation_id_required") String conversation_id,
        @NotBlank(message = "creator_id_required") String creator_id,
        String display_id
) {
}
