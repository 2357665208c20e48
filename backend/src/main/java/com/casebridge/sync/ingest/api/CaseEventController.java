package com.casebridge.sync.ingest.api;

import com.casebridge.sync.auth.service.CallerAuthorizer;
import com.casebridge.sync.common.api.ApiResponse;
import com.casebridge.sync.ingest.service.CaseEvent;
import com.casebridge.sync.ingest.service.NotificationIngestService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/v1/ingest")
public class CaseEventController {

    private final NotificationIngestService ingestService;
    private final CallerAuthorizer authorizer;

    public CaseEventController(NotificationIngestService ingestService, CallerAuthorizer authorizer) {
        this.ingestService = ingestService;
        this.authorizer = authorizer;
    }

    @PostMapping("/case-events")
    public ApiResponse<CaseEventResponse> ingest(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody CaseEventRequest req
    ) {
        authorizer.require(authorization, CallerAuthorizer.ROLE_TRANSPORT);

        var event = new CaseEvent(req.account_key().trim(), req.case_id().trim(), req.event_kind(), parseEventTime(req.event_time()));
        var outcome = ingestService.ingest(event);
        var t = outcome.transition();
        return ApiResponse.ok(new CaseEventResponse(
                outcome.outcome(),
                t == null || t.before() == null ? null : t.before().name(),
                t == null || t.after() == null ? null : t.after().name(),
                t != null && t.changed(),
                t == null ? null : t.conversationId(),
                outcome.communicationsRelayed()
        ));
    }

    static Instant parseEventTime(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(value));
            }
            return OffsetDateTime.parse(value).toInstant();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("invalid_event_time");
        }
    }
}
