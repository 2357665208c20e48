package com.casebridge.sync.backend.aws;

import com.casebridge.sync.cases.model.CaseStatus;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.support.model.CaseDetails;
import software.amazon.awssdk.services.support.model.Communication;
import software.amazon.awssdk.services.support.model.RecentCaseCommunications;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AwsSupportCaseBackendTest {

    @Test
    void maps_case_details_and_collapses_status() {
        var details = CaseDetails.builder()
                .caseId("case-123")
                .displayId("1234567890")
                .status("pending-customer-action")
                .recentCommunications(RecentCaseCommunications.builder()
                        .communications(
                                Communication.builder().body("first").submittedBy("support@amazon.com")
                                        .timeCreated("2026-01-05T08:00:00.123Z").build(),
                                Communication.builder().body("no time").submittedBy("x").build()
                        )
                        .build())
                .build();

        var remote = AwsSupportCaseBackend.toRemoteCase(details);

        assertEquals("case-123", remote.caseId());
        assertEquals("1234567890", remote.displayId());
        assertEquals("pending-customer-action", remote.backendStatus());
        assertEquals(CaseStatus.PENDING, remote.status());
        assertEquals(1, remote.communications().size());
        assertEquals(Instant.parse("2026-01-05T08:00:00.123Z"), remote.communications().get(0).timeCreated());
    }

    @Test
    void parses_backend_timestamps() {
        assertEquals(Instant.parse("2026-01-05T08:00:00Z"), AwsSupportCaseBackend.parseTime("2026-01-05T08:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T07:00:00Z"), AwsSupportCaseBackend.parseTime("2026-01-05T08:00:00+01:00"));
        assertNull(AwsSupportCaseBackend.parseTime("not a time"));
        assertNull(AwsSupportCaseBackend.parseTime(" "));
    }
}
