package com.casebridge.sync.notify.service;

import com.casebridge.sync.cases.model.DedupKeys;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.notify.DispatchKind;
import com.casebridge.sync.notify.repo.OutboundDispatchRepository;
import com.casebridge.sync.notify.transport.ChatTransport;
import com.casebridge.sync.notify.transport.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Outbox in front of the chat transport.
 *
 * A dispatch is rendered once and stored under its identity in the caller's transaction; delivery runs after
 * commit and, on failure, from {@link OutboundDispatchScheduler} with exponential backoff. Enqueueing an identity
 * that already exists is a no-op, so one logical transition or action yields at most one message.
 * Callers that hold a per-case lock wrap their work in {@link #deferDelivery(Supplier)} so the transport is only
 * called once the lock is released.
 */
@Service
public class OutboundNotifier {

    private static final Logger log = LoggerFactory.getLogger(OutboundNotifier.class);

    private static final Duration SEND_LEASE = Duration.ofSeconds(60);
    private static final long MAX_BACKOFF_SECONDS = 300;

    private final OutboundDispatchRepository dispatchRepository;
    private final ChatTransport chatTransport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxAttempts;

    private final Counter delivered;
    private final Counter failed;

    private final ThreadLocal<List<String>> deferred = new ThreadLocal<>();

    public OutboundNotifier(
            OutboundDispatchRepository dispatchRepository,
            ChatTransport chatTransport,
            ObjectMapper objectMapper,
            Clock clock,
            SyncProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.dispatchRepository = dispatchRepository;
        this.chatTransport = chatTransport;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxAttempts = properties.outboxMaxAttempts();

        this.delivered = Counter.builder("casebridge.outbound.delivered")
                .description("Outbound dispatches delivered to the chat transport")
                .register(meterRegistry);
        this.failed = Counter.builder("casebridge.outbound.failed")
                .description("Outbound delivery attempts that failed")
                .register(meterRegistry);
    }

    /**
     * Builds a dispatch identity short enough for the transport's idempotency key.
     */
    public static String dispatchId(DispatchKind kind, String... parts) {
        return kind.idPrefix() + "-" + DedupKeys.sha256Hex(String.join("|", parts)).substring(0, 40);
    }

    /**
     * Stores the dispatch and schedules delivery after the surrounding transaction commits.
     *
     * @return false when this identity was already enqueued
     */
    public boolean enqueue(String dispatchId, String conversationId, DispatchKind kind, String text) {
        if (dispatchRepository.exists(dispatchId)) {
            log.debug("outbound_dispatch_exists dispatchId={}", dispatchId);
            return false;
        }
        dispatchRepository.insert(dispatchId, conversationId, kind, toPayload(text), clock.instant());
        afterCommit(dispatchId);
        return true;
    }

    /**
     * Runs {@code work} and holds back deliveries it commits until it returns. Nested calls join the outer one.
     */
    public <T> T deferDelivery(Supplier<T> work) {
        if (deferred.get() != null) {
            return work.get();
        }
        var pending = new ArrayList<String>();
        deferred.set(pending);
        try {
            return work.get();
        } finally {
            deferred.remove();
            for (var id : pending) {
                deliverQuietly(id);
            }
        }
    }

    /**
     * Attempts one delivery of a pending dispatch.
     *
     * @return true when the dispatch is delivered (now or earlier)
     */
    public boolean dispatchNow(String dispatchId) {
        var now = clock.instant();
        if (!dispatchRepository.claim(dispatchId, now, now.plus(SEND_LEASE))) {
            return dispatchRepository.findById(dispatchId)
                    .map(r -> OutboundDispatchRepository.STATUS_DELIVERED.equals(r.status()))
                    .orElse(false);
        }
        var row = dispatchRepository.findById(dispatchId).orElse(null);
        if (row == null) return false;

        int attempts = row.attempts() + 1;
        try {
            chatTransport.deliver(new OutboundMessage(row.id(), row.conversationId(), row.kind(), fromPayload(row.payloadJson())));
            dispatchRepository.markDelivered(row.id(), attempts, clock.instant());
            delivered.increment();
            log.info("outbound_delivered dispatchId={} conversationId={} kind={} attempts={}",
                    row.id(), row.conversationId(), row.kind(), attempts);
            return true;
        } catch (Exception e) {
            failed.increment();
            if (attempts >= maxAttempts) {
                dispatchRepository.markFailed(row.id(), attempts, e.getMessage());
                log.error("outbound_gave_up dispatchId={} conversationId={} kind={} attempts={}",
                        row.id(), row.conversationId(), row.kind(), attempts, e);
            } else {
                var next = clock.instant().plusSeconds(backoffSeconds(attempts));
                dispatchRepository.markRetry(row.id(), attempts, next, e.getMessage());
                log.warn("outbound_delivery_failed dispatchId={} conversationId={} attempts={} nextAttemptAt={} reason={}",
                        row.id(), row.conversationId(), attempts, next, e.getMessage());
            }
            return false;
        }
    }

    static long backoffSeconds(int attempts) {
        if (attempts >= 9) return MAX_BACKOFF_SECONDS;
        return Math.min(MAX_BACKOFF_SECONDS, 1L << Math.max(1, attempts));
    }

    private String toPayload(String text) {
        try {
            return objectMapper.writeValueAsString(Map.of("text", text == null ? "" : text));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("payload_encode_failed", e);
        }
    }

    private String fromPayload(String payloadJson) {
        try {
            return objectMapper.readTree(payloadJson).path("text").asText("");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("payload_decode_failed", e);
        }
    }

    private void afterCommit(String dispatchId) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deliverOrHold(dispatchId);
                }
            });
        } else {
            deliverOrHold(dispatchId);
        }
    }

    private void deliverOrHold(String dispatchId) {
        var pending = deferred.get();
        if (pending != null) {
            pending.add(dispatchId);
        } else {
            deliverQuietly(dispatchId);
        }
    }

    private void deliverQuietly(String dispatchId) {
        try {
            dispatchNow(dispatchId);
        } catch (Exception e) {
            // The row stays pending and the sweep picks it up.
            log.warn("outbound_after_commit_failed dispatchId={}", dispatchId, e);
        }
    }
}
