package com.casebridge.sync.lifecycle;

import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.Conversation;
import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.cases.repo.SupportCaseRepository;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.common.concurrent.KeyedLocks;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.notify.DispatchKind;
import com.casebridge.sync.notify.service.MessageRenderer;
import com.casebridge.sync.notify.service.OutboundNotifier;
import com.casebridge.sync.notify.service.RenderContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Conversation-side lifecycle: the pre-archive warning, the scheduled archive and the creator's manual archive.
 *
 * Each decision re-reads the conversation and its case under the case key lock. Nothing observed by an earlier
 * scan is trusted, so a reopen that lands before the decision point always wins.
 */
@Service
public class ConversationLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ConversationLifecycleService.class);

    static final String REASON_GRACE_ELAPSED = "grace_elapsed";
    static final String REASON_REQUESTED = "requested";

    private final ConversationRepository conversationRepository;
    private final SupportCaseRepository caseRepository;
    private final KeyedLocks keyedLocks;
    private final TransactionTemplate transactionTemplate;
    private final OutboundNotifier notifier;
    private final MessageRenderer renderer;
    private final Clock clock;
    private final Duration gracePeriod;
    private final Duration warningLeadTime;

    private final Counter warned;
    private final Counter archived;

    public ConversationLifecycleService(
            ConversationRepository conversationRepository,
            SupportCaseRepository caseRepository,
            KeyedLocks keyedLocks,
            TransactionTemplate transactionTemplate,
            OutboundNotifier notifier,
            MessageRenderer renderer,
            Clock clock,
            SyncProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.conversationRepository = conversationRepository;
        this.caseRepository = caseRepository;
        this.keyedLocks = keyedLocks;
        this.transactionTemplate = transactionTemplate;
        this.notifier = notifier;
        this.renderer = renderer;
        this.clock = clock;
        this.gracePeriod = properties.gracePeriod();
        this.warningLeadTime = properties.warningLeadTime();

        this.warned = Counter.builder("casebridge.lifecycle.warned").register(meterRegistry);
        this.archived = Counter.builder("casebridge.lifecycle.archived").register(meterRegistry);
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    public Duration warningThreshold() {
        return gracePeriod.minus(warningLeadTime);
    }

    /**
     * Issues the pre-archive warning once per resolution.
     *
     * @return true when a warning was enqueued by this call
     */
    public boolean warnIfDue(String conversationId, Instant now) {
        var lockKey = lockKeyOf(conversationId);
        if (lockKey == null) return false;

        Boolean done = notifier.deferDelivery(() -> keyedLocks.withLock(lockKey, () -> transactionTemplate.execute(status -> {
            var conv = conversationRepository.findById(conversationId).orElse(null);
            if (conv == null || conv.archived() || conv.resolvedAt() == null || conv.warnedAt() != null) return false;

            var elapsed = Duration.between(conv.resolvedAt(), now);
            if (elapsed.compareTo(warningThreshold()) < 0 || elapsed.compareTo(gracePeriod) >= 0) return false;
            if (!caseIsResolved(conv)) return false;

            if (!conversationRepository.markWarned(conv.id(), conv.resolvedAt(), now)) return false;
            var remaining = gracePeriod.minus(elapsed);
            var dispatchId = OutboundNotifier.dispatchId(DispatchKind.WARN, conv.id(), conv.resolvedAt().toString());
            notifier.enqueue(dispatchId, conv.id(), DispatchKind.WARN, renderer.archiveWarning(contextOf(conv), remaining));
            return true;
        })));

        if (Boolean.TRUE.equals(done)) {
            warned.increment();
            log.info("archive_warning_issued conversationId={}", conversationId);
            return true;
        }
        return false;
    }

    /**
     * Archives the conversation if it has been resolved for the full grace period and the case is still resolved.
     *
     * @return true when this call archived the conversation
     */
    public boolean archiveIfDue(String conversationId, Instant now) {
        var lockKey = lockKeyOf(conversationId);
        if (lockKey == null) return false;

        Boolean done = notifier.deferDelivery(() -> keyedLocks.withLock(lockKey, () -> transactionTemplate.execute(status -> {
            var conv = conversationRepository.findById(conversationId).orElse(null);
            if (conv == null || conv.archived() || conv.resolvedAt() == null) return false;
            if (Duration.between(conv.resolvedAt(), now).compareTo(gracePeriod) < 0) return false;
            if (!caseIsResolved(conv)) {
                log.info("archive_aborted_case_not_resolved conversationId={} case={}", conv.id(), conv.caseId());
                return false;
            }
            return archiveLocked(conv, REASON_GRACE_ELAPSED, now);
        })));

        if (Boolean.TRUE.equals(done)) {
            archived.increment();
            log.info("conversation_archived conversationId={} reason={}", conversationId, REASON_GRACE_ELAPSED);
            return true;
        }
        return false;
    }

    /**
     * Immediate archive requested by the conversation's creator. Archiving an archived conversation is a no-op.
     */
    public Conversation archiveByRequest(String conversationId, String requesterId) {
        if (conversationId == null || conversationId.isBlank() || requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("missing_archive_fields");
        }
        var conv = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("conversation_not_found"));
        if (!conv.creatorId().equals(requesterId)) {
            throw new IllegalArgumentException("forbidden");
        }
        if (conv.archived()) {
            return conv;
        }

        var lockKey = CaseRegistryService.caseKey(conv.accountKey(), conv.caseId());
        Boolean done = notifier.deferDelivery(() -> keyedLocks.withLock(lockKey, () -> transactionTemplate.execute(status -> {
            var current = conversationRepository.findById(conversationId).orElseThrow();
            if (current.archived()) return false;
            return archiveLocked(current, REASON_REQUESTED, clock.instant());
        })));

        if (Boolean.TRUE.equals(done)) {
            archived.increment();
            log.info("conversation_archived conversationId={} reason={} requester={}", conversationId, REASON_REQUESTED, requesterId);
        }
        return conversationRepository.findById(conversationId).orElseThrow();
    }

    private boolean archiveLocked(Conversation conv, String reason, Instant now) {
        if (!conversationRepository.markArchived(conv.id(), reason, now)) return false;
        var dispatchId = OutboundNotifier.dispatchId(DispatchKind.ARCHIVE, conv.id());
        notifier.enqueue(dispatchId, conv.id(), DispatchKind.ARCHIVE, renderer.archived(contextOf(conv), reason));
        return true;
    }

    private boolean caseIsResolved(Conversation conv) {
        return caseRepository.find(conv.accountKey(), conv.caseId())
                .map(sc -> sc.status() == CaseStatus.RESOLVED)
                .orElse(false);
    }

    private RenderContext contextOf(Conversation conv) {
        var displayId = caseRepository.find(conv.accountKey(), conv.caseId()).map(sc -> sc.displayId()).orElse(null);
        return new RenderContext(conv.accountKey(), conv.caseId(), displayId);
    }

    private String lockKeyOf(String conversationId) {
        return conversationRepository.findById(conversationId)
                .map(c -> CaseRegistryService.caseKey(c.accountKey(), c.caseId()))
                .orElse(null);
    }
}
