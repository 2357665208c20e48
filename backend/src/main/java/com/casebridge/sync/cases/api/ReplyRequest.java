package com.casebridge.sync.cases.api;

import jakarta.validation.constraints.NotBlank;

public record ReplyRequest(
        String sender_name,
        @NotBlank(message = "text_required") String text
) {
}
