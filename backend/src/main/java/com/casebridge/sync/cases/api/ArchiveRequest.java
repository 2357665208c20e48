package com.casebridge.sync.cases.api;

import jakarta.validation.constraints.NotBlank;

public record ArchiveRequest(
        @NotBlank(message = "requester_id_required") String requester_id
) {
}
