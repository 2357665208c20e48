package com.casebridge.sync.notify.service;

import com.casebridge.sync.bootstrap.CaseBridgeApplication;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.DedupKeys;
import com.casebridge.sync.cases.model.TransitionResult;
import com.casebridge.sync.cases.model.TransitionSource;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.common.concurrent.KeyedLocks;
import com.casebridge.sync.lifecycle.ConversationLifecycleService;
import com.casebridge.sync.notify.DispatchKind;
import com.casebridge.sync.notify.repo.OutboundDispatchRepository;
import com.casebridge.sync.support.MutableClock;
import com.casebridge.sync.support.RecordingChatTransport;
import com.casebridge.sync.support.SyncTestBeans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = CaseBridgeApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(SyncTestBeans.class)
class OutboundNotifierTest {

    @Autowired
    CaseRegistryService registry;

    @Autowired
    OutboundNotifier notifier;

    @Autowired
    OutboundDispatchScheduler scheduler;

    @Autowired
    OutboundDispatchRepository dispatchRepository;

    @Autowired
    ConversationLifecycleService lifecycleService;

    @Autowired
    KeyedLocks keyedLocks;

    @Autowired
    MutableClock clock;

    @Autowired
    RecordingChatTransport transport;

    @BeforeEach
    void setUp() {
        clock.reset();
        transport.reset();
    }

    @Test
    void failed_delivery_is_retried_after_backoff_with_the_same_text() {
        var caseId = "case-" + UUID.randomUUID();
        var conv = registry.createMapping("acct-0", caseId, "oc_" + UUID.randomUUID(), "user-a", "D-1");
        transport.failFor(conv.id());

        var result = resolve(caseId);
        assertTrue(result.applied());
        assertTrue(transport.messagesFor(conv.id()).isEmpty());

        var row = dispatchRepository.findById(result.dispatchId()).orElseThrow();
        assertEquals(OutboundDispatchRepository.STATUS_PENDING, row.status());
        assertEquals(1, row.attempts());

        transport.recover(conv.id());
        // Backoff has not elapsed yet.
        scheduler.sweepOnce();
        assertTrue(transport.messagesFor(conv.id()).isEmpty());

        clock.advance(Duration.ofSeconds(OutboundNotifier.backoffSeconds(1) + 1));
        scheduler.sweepOnce();

        var delivered = transport.messagesFor(conv.id(), DispatchKind.STATUS);
        assertEquals(1, delivered.size());
        assertEquals(result.dispatchId(), delivered.get(0).dispatchId());
        assertTrue(delivered.get(0).text().contains("Open -> Resolved"));

        var after = dispatchRepository.findById(result.dispatchId()).orElseThrow();
        assertEquals(OutboundDispatchRepository.STATUS_DELIVERED, after.status());
        assertEquals(2, after.attempts());

        // Delivered rows are not picked up again.
        clock.advance(Duration.ofMinutes(10));
        scheduler.sweepOnce();
        assertEquals(1, transport.messagesFor(conv.id()).size());
    }

    @Test
    void gives_up_after_max_attempts() {
        var caseId = "case-" + UUID.randomUUID();
        var conv = registry.createMapping("acct-0", caseId, "oc_" + UUID.randomUUID(), "user-a", null);
        transport.failFor(conv.id());

        var result = resolve(caseId);
        for (int i = 0; i < 12; i++) {
            clock.advance(Duration.ofSeconds(301));
            scheduler.sweepOnce();
        }

        var row = dispatchRepository.findById(result.dispatchId()).orElseThrow();
        assertEquals(OutboundDispatchRepository.STATUS_FAILED, row.status());
        assertEquals(10, row.attempts());
        assertTrue(transport.messagesFor(conv.id()).isEmpty());
    }

    @Test
    void status_and_archive_messages_are_sent_with_the_case_lock_free() {
        var caseId = "case-" + UUID.randomUUID();
        var conv = registry.createMapping("acct-0", caseId, "oc_" + UUID.randomUUID(), "user-a", null);
        var lockKey = CaseRegistryService.caseKey("acct-0", caseId);
        var lockFreeDuringDelivery = new CopyOnWriteArrayList<Boolean>();
        transport.onDeliver(m -> lockFreeDuringDelivery.add(lockIsFree(lockKey)));

        assertTrue(resolve(caseId).applied());
        lifecycleService.archiveByRequest(conv.id(), "user-a");

        assertEquals(1, transport.messagesFor(conv.id(), DispatchKind.STATUS).size());
        assertEquals(1, transport.messagesFor(conv.id(), DispatchKind.ARCHIVE).size());
        assertEquals(List.of(true, true), lockFreeDuringDelivery);
    }

    @Test
    void deferred_work_delivers_only_when_it_returns() {
        var conversationId = "oc_" + UUID.randomUUID();
        var outer = OutboundNotifier.dispatchId(DispatchKind.WARN, conversationId, "outer");
        var inner = OutboundNotifier.dispatchId(DispatchKind.WARN, conversationId, "inner");

        int seenInside = notifier.deferDelivery(() -> {
            notifier.enqueue(outer, conversationId, DispatchKind.WARN, "outer");
            notifier.deferDelivery(() -> notifier.enqueue(inner, conversationId, DispatchKind.WARN, "inner"));
            return transport.messagesFor(conversationId).size();
        });

        assertEquals(0, seenInside);
        assertEquals(2, transport.messagesFor(conversationId).size());
    }

    @Test
    void enqueue_is_idempotent_per_dispatch_id() {
        var conversationId = "oc_" + UUID.randomUUID();
        var id = OutboundNotifier.dispatchId(DispatchKind.WARN, conversationId, "1");

        assertTrue(notifier.enqueue(id, conversationId, DispatchKind.WARN, "first"));
        assertFalse(notifier.enqueue(id, conversationId, DispatchKind.WARN, "second"));

        var messages = transport.messagesFor(conversationId);
        assertEquals(1, messages.size());
        assertEquals("first", messages.get(0).text());
    }

    @Test
    void dispatch_ids_are_prefixed_and_bounded() {
        var a = OutboundNotifier.dispatchId(DispatchKind.STATUS, "acct-0", "c-1", "RESOLVED");
        var b = OutboundNotifier.dispatchId(DispatchKind.STATUS, "acct-0", "c-1", "REOPENED");

        assertTrue(a.startsWith("st-"));
        assertEquals(43, a.length());
        assertNotEquals(a, b);
        assertEquals(a, OutboundNotifier.dispatchId(DispatchKind.STATUS, "acct-0", "c-1", "RESOLVED"));
    }

    @Test
    void backoff_doubles_up_to_five_minutes() {
        assertEquals(2, OutboundNotifier.backoffSeconds(1));
        assertEquals(4, OutboundNotifier.backoffSeconds(2));
        assertEquals(256, OutboundNotifier.backoffSeconds(8));
        assertEquals(300, OutboundNotifier.backoffSeconds(9));
        assertEquals(300, OutboundNotifier.backoffSeconds(40));
    }

    private boolean lockIsFree(String lockKey) {
        var pool = Executors.newSingleThreadExecutor();
        try {
            return pool.submit(() -> keyedLocks.withLock(lockKey, () -> true)).get(2, TimeUnit.SECONDS);
        } catch (Exception e) {
            return false;
        } finally {
            pool.shutdownNow();
        }
    }

    private TransitionResult resolve(String caseId) {
        var key = DedupKeys.forObservation("acct-0", caseId, CaseStatus.RESOLVED, clock.instant(), Duration.ofMinutes(5));
        return registry.applyTransition("acct-0", caseId, CaseStatus.RESOLVED, TransitionSource.PUSH, key);
    }
}
