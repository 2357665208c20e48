package com.casebridge.sync.poller.service;

import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.bootstrap.CaseBridgeApplication;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.notify.DispatchKind;
import com.casebridge.sync.support.FakeCaseBackend;
import com.casebridge.sync.support.FakeIdentityExchange;
import com.casebridge.sync.support.MutableClock;
import com.casebridge.sync.support.RecordingChatTransport;
import com.casebridge.sync.support.SyncTestBeans;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = CaseBridgeApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(SyncTestBeans.class)
class ReconciliationPollerTest {

    @Autowired
    ReconciliationPoller poller;

    @Autowired
    CaseRegistryService registry;

    @Autowired
    MutableClock clock;

    @Autowired
    FakeIdentityExchange identityExchange;

    @Autowired
    FakeCaseBackend caseBackend;

    @Autowired
    RecordingChatTransport transport;

    @Autowired
    MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock.reset();
        identityExchange.reset();
        caseBackend.reset();
        transport.reset();
    }

    @Test
    void applies_status_changes_missed_by_push() {
        var caseId = newCaseId();
        var conv = registry.createMapping("acct-0", caseId, newConversationId(), "user-a", null);
        caseBackend.put("acct-0", caseId, CaseStatus.PENDING);

        var report = poller.runCycle();

        assertEquals(CaseStatus.PENDING, registry.lookupByConversation(conv.id()).orElseThrow().supportCase().status());
        assertEquals(AccountPollResult.Status.OK, report.forAccount("acct-0").status());
        assertTrue(report.forAccount("acct-0").transitionsApplied() >= 1);
        assertEquals(1, transport.messagesFor(conv.id(), DispatchKind.STATUS).size());

        // Nothing changed upstream: the next cycle is silent.
        clock.advance(Duration.ofMinutes(10));
        poller.runCycle();
        assertEquals(1, transport.messagesFor(conv.id(), DispatchKind.STATUS).size());
    }

    @Test
    void failing_account_does_not_block_others() {
        var healthyCase = newCaseId();
        var healthy = registry.createMapping("acct-0", healthyCase, newConversationId(), "user-a", null);
        caseBackend.put("acct-0", healthyCase, CaseStatus.RESOLVED);

        var backendDownCase = newCaseId();
        registry.createMapping("acct-1", backendDownCase, newConversationId(), "user-a", null);
        caseBackend.put("acct-1", backendDownCase, CaseStatus.RESOLVED);
        caseBackend.failFor("acct-1");

        var brokenCase = newCaseId();
        registry.createMapping("acct-broken", brokenCase, newConversationId(), "user-a", null);
        caseBackend.put("acct-broken", brokenCase, CaseStatus.RESOLVED);
        identityExchange.failFor("acct-broken");
        // Move past any lease cached by earlier cycles so every account renews.
        clock.advance(Duration.ofDays(7));

        var report = poller.runCycle();

        assertEquals(AccountPollResult.Status.OK, report.forAccount("acct-0").status());
        assertEquals(AccountPollResult.Status.FAILED, report.forAccount("acct-1").status());
        assertEquals(AccountPollResult.Status.FAILED, report.forAccount("acct-broken").status());
        assertNotNull(report.forAccount("acct-broken").error());
        assertEquals(2L, report.failedAccounts());

        assertEquals(CaseStatus.RESOLVED, registry.lookupByConversation(healthy.id()).orElseThrow().supportCase().status());
        assertEquals(CaseStatus.OPEN, registry.lookupByCase("acct-1", backendDownCase)
                .flatMap(c -> registry.lookupByConversation(c.id())).orElseThrow().supportCase().status());
        assertTrue(poller.lastCycle().isPresent());
    }

    @Test
    void hung_account_times_out_and_is_counted_once() {
        var healthyCase = newCaseId();
        var healthy = registry.createMapping("acct-0", healthyCase, newConversationId(), "user-a", null);
        caseBackend.put("acct-0", healthyCase, CaseStatus.PENDING);

        var hungCase = newCaseId();
        registry.createMapping("acct-1", hungCase, newConversationId(), "user-a", null);
        caseBackend.put("acct-1", hungCase, CaseStatus.PENDING);
        var release = new CountDownLatch(1);
        caseBackend.blockFor("acct-1", release);

        double failuresBefore = accountFailures();
        try {
            long start = System.nanoTime();
            var report = poller.runCycle();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(AccountPollResult.Status.OK, report.forAccount("acct-0").status());
            assertEquals(AccountPollResult.Status.TIMED_OUT, report.forAccount("acct-1").status());
            assertEquals(1L, report.failedAccounts());
            assertEquals(CaseStatus.PENDING, registry.lookupByConversation(healthy.id()).orElseThrow().supportCase().status());
            // One wave of accounts at the 5s test budget.
            assertTrue(elapsedMs < 15_000, "cycle took " + elapsedMs + "ms");
            assertEquals(1.0, accountFailures() - failuresBefore);
        } finally {
            release.countDown();
        }
    }

    @Test
    void pages_through_every_live_conversation() {
        // The test profile pages two conversations at a time.
        var conversations = new ArrayList<String>();
        for (int i = 0; i < 5; i++) {
            var caseId = newCaseId();
            conversations.add(registry.createMapping("acct-0", caseId, newConversationId(), "user-a", null).id());
            caseBackend.put("acct-0", caseId, CaseStatus.PENDING);
        }

        poller.runCycle();

        for (var id : conversations) {
            assertEquals(CaseStatus.PENDING, registry.lookupByConversation(id).orElseThrow().supportCase().status());
        }
    }

    @Test
    void rejected_credential_is_renewed_and_retried_once() {
        var caseId = newCaseId();
        var conv = registry.createMapping("acct-0", caseId, newConversationId(), "user-a", null);
        caseBackend.put("acct-0", caseId, CaseStatus.PENDING);
        caseBackend.rejectCredentialOnce("acct-0");

        var report = poller.runCycle();

        assertEquals(AccountPollResult.Status.OK, report.forAccount("acct-0").status());
        assertTrue(identityExchange.calls("acct-0") >= 1);
        assertEquals(CaseStatus.PENDING, registry.lookupByConversation(conv.id()).orElseThrow().supportCase().status());
    }

    @Test
    void relays_new_communications_once() {
        var caseId = newCaseId();
        var conv = registry.createMapping("acct-0", caseId, newConversationId(), "user-a", null);
        var now = clock.instant();
        caseBackend.put("acct-0", caseId, CaseStatus.OPEN, List.of(
                new RemoteCommunication("Old reply", "support@amazon.com", now.minus(Duration.ofHours(2))),
                new RemoteCommunication("We are looking into it.", "support@amazon.com", now.minus(Duration.ofMinutes(3))),
                new RemoteCommunication("[From Alice via Lark] any update?", "bridge-role", now.minus(Duration.ofMinutes(2)))
        ));

        poller.runCycle();
        clock.advance(Duration.ofMinutes(10));
        poller.runCycle();

        var relayed = transport.messagesFor(conv.id(), DispatchKind.COMMUNICATION);
        assertEquals(1, relayed.size());
        assertTrue(relayed.get(0).text().contains("We are looking into it."));
        assertTrue(relayed.get(0).text().contains("AWS Support"));
    }

    private double accountFailures() {
        return meterRegistry.counter("casebridge.poll.account_failures").count();
    }

    private static String newCaseId() {
        return "case-" + UUID.randomUUID();
    }

    private static String newConversationId() {
        return "oc_" + UUID.randomUUID();
    }
}
