package com.casebridge.sync.cases.service;

import com.casebridge.sync.account.AccountRegistry;
import com.casebridge.sync.cases.model.CaseMapping;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.Conversation;
import com.casebridge.sync.cases.model.MappingAlreadyExistsException;
import com.casebridge.sync.cases.model.TransitionOutcome;
import com.casebridge.sync.cases.model.TransitionResult;
import com.casebridge.sync.cases.model.TransitionSource;
import com.casebridge.sync.cases.repo.CaseTransitionRepository;
import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.cases.repo.SupportCaseRepository;
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
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable case/conversation mappings and the single entry point for case status changes.
 *
 * Every mutation for one (account, case) runs under that key's lock and inside one transaction; unrelated cases
 * never contend. Across instances the version column on {@code support_case} is compared-and-set.
 */
@Service
public class CaseRegistryService {

    private static final Logger log = LoggerFactory.getLogger(CaseRegistryService.class);

    private static final int MAX_CAS_ATTEMPTS = 3;
    static final int DEFAULT_PARTICIPANT_LIMIT = 10;
    static final int MAX_PARTICIPANT_LIMIT = 100;

    private final SupportCaseRepository caseRepository;
    private final ConversationRepository conversationRepository;
    private final CaseTransitionRepository transitionRepository;
    private final AccountRegistry accountRegistry;
    private final KeyedLocks keyedLocks;
    private final TransactionTemplate transactionTemplate;
    private final OutboundNotifier notifier;
    private final MessageRenderer renderer;
    private final Clock clock;
    private final Duration transitionRetention;

    private final Counter applied;
    private final Counter duplicates;
    private final Counter rejected;
    private final Counter notFound;

    public CaseRegistryService(
            SupportCaseRepository caseRepository,
            ConversationRepository conversationRepository,
            CaseTransitionRepository transitionRepository,
            AccountRegistry accountRegistry,
            KeyedLocks keyedLocks,
            TransactionTemplate transactionTemplate,
            OutboundNotifier notifier,
            MessageRenderer renderer,
            Clock clock,
            SyncProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.caseRepository = caseRepository;
        this.conversationRepository = conversationRepository;
        this.transitionRepository = transitionRepository;
        this.accountRegistry = accountRegistry;
        this.keyedLocks = keyedLocks;
        this.transactionTemplate = transactionTemplate;
        this.notifier = notifier;
        this.renderer = renderer;
        this.clock = clock;
        this.transitionRetention = properties.transitionRetention();

        this.applied = Counter.builder("casebridge.transition.applied").register(meterRegistry);
        this.duplicates = Counter.builder("casebridge.transition.duplicate").register(meterRegistry);
        this.rejected = Counter.builder("casebridge.transition.rejected").register(meterRegistry);
        this.notFound = Counter.builder("casebridge.transition.not_found").register(meterRegistry);
    }

    public static String caseKey(String accountKey, String caseId) {
        return "case:" + accountKey + ":" + caseId;
    }

    /**
     * The live conversation of a case; empty when none was created or it is archived.
     */
    public Optional<Conversation> lookupByCase(String accountKey, String caseId) {
        if (isBlank(accountKey) || isBlank(caseId)) return Optional.empty();
        return conversationRepository.findLiveByCase(accountKey, caseId);
    }

    /**
     * Archived conversations are returned too.
     */
    public Optional<CaseMapping> lookupByConversation(String conversationId) {
        if (isBlank(conversationId)) return Optional.empty();
        return conversationRepository.findById(conversationId)
                .flatMap(conv -> caseRepository.find(conv.accountKey(), conv.caseId())
                        .map(sc -> new CaseMapping(sc, conv)));
    }

    public List<Conversation> listByParticipant(String participantId, Integer limit) {
        if (isBlank(participantId)) {
            throw new IllegalArgumentException("missing_participant_id");
        }
        int n = limit == null ? DEFAULT_PARTICIPANT_LIMIT : Math.max(1, Math.min(limit, MAX_PARTICIPANT_LIMIT));
        return conversationRepository.listByParticipant(participantId, n);
    }

    /**
     * Binds a new conversation to a case. The case row is created as OPEN when this system has not seen it yet.
     *
     * @throws MappingAlreadyExistsException when the case already has a live conversation
     * @throws com.casebridge.sync.account.AccountNotFoundException for an unknown account
     */
    public Conversation createMapping(String accountKey, String caseId, String conversationId, String creatorId, String displayId) {
        if (isBlank(accountKey) || isBlank(caseId) || isBlank(conversationId) || isBlank(creatorId)) {
            throw new IllegalArgumentException("missing_mapping_fields");
        }
        accountRegistry.require(accountKey);

        try {
            return keyedLocks.withLock(caseKey(accountKey, caseId), () -> transactionTemplate.execute(status -> {
                var live = conversationRepository.findLiveByCase(accountKey, caseId);
                if (live.isPresent()) {
                    throw new MappingAlreadyExistsException(accountKey, caseId, live.get().id());
                }
                if (conversationRepository.findById(conversationId).isPresent()) {
                    throw new IllegalArgumentException("conversation_id_taken");
                }
                var now = clock.instant();
                caseRepository.insertIfAbsent(accountKey, caseId, displayId, now);
                conversationRepository.insert(conversationId, accountKey, caseId, creatorId, now);
                log.info("mapping_created account={} case={} conversationId={} creator={}", accountKey, caseId, conversationId, creatorId);
                return conversationRepository.findById(conversationId).orElseThrow();
            }));
        } catch (DuplicateKeyException e) {
            // Lost a race with another instance.
            var live = conversationRepository.findLiveByCase(accountKey, caseId);
            if (live.isPresent()) {
                throw new MappingAlreadyExistsException(accountKey, caseId, live.get().id());
            }
            throw new IllegalArgumentException("conversation_id_taken");
        }
    }

    /**
     * Applies one observed status. Atomic per (account, case): dedup check, status read, edge validation and status
     * write form one unit. Only APPLIED with a real status change has side effects (one outbound dispatch).
     */
    public TransitionResult applyTransition(
            String accountKey,
            String caseId,
            CaseStatus observed,
            TransitionSource source,
            String dedupKey
    ) {
        if (isBlank(accountKey) || isBlank(caseId) || observed == null || source == null || isBlank(dedupKey)) {
            throw new IllegalArgumentException("invalid_transition");
        }

        // The status message goes out after the case lock is released.
        var result = notifier.deferDelivery(() -> applyWithRetry(accountKey, caseId, observed, source, dedupKey));
        report(result, source);
        return result;
    }

    private TransitionResult applyWithRetry(
            String accountKey,
            String caseId,
            CaseStatus observed,
            TransitionSource source,
            String dedupKey
    ) {
        TransitionResult result = null;
        for (int attempt = 1; result == null; attempt++) {
            try {
                result = keyedLocks.withLock(caseKey(accountKey, caseId), () -> transactionTemplate.execute(
                        status -> applyLocked(accountKey, caseId, observed, source, dedupKey, status)
                ));
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_CAS_ATTEMPTS) throw e;
                log.debug("transition_cas_retry account={} case={} attempt={}", accountKey, caseId, attempt);
            }
        }
        return result;
    }

    private TransitionResult applyLocked(
            String accountKey,
            String caseId,
            CaseStatus observed,
            TransitionSource source,
            String dedupKey,
            TransactionStatus tx
    ) {
        var now = clock.instant();
        // A key stays known for the whole retention period so a late replay cannot undo a newer change.
        var retainedSince = now.minus(transitionRetention);

        if (transitionRepository.existsSince(dedupKey, retainedSince)) {
            return TransitionResult.duplicate(accountKey, caseId, observed, dedupKey);
        }

        var conversation = conversationRepository.findLiveByCase(accountKey, caseId).orElse(null);
        var supportCase = conversation == null ? null : caseRepository.find(accountKey, caseId).orElse(null);
        if (supportCase == null) {
            return TransitionResult.notFound(accountKey, caseId, observed, dedupKey);
        }

        var before = supportCase.status();
        TransitionOutcome outcome;
        if (before == observed) {
            outcome = TransitionOutcome.APPLIED;
        } else if (before.canTransitionTo(observed)) {
            outcome = TransitionOutcome.APPLIED;
        } else {
            outcome = TransitionOutcome.REJECTED_INVALID_EDGE;
        }

        if (!transitionRepository.record(dedupKey, accountKey, caseId, source, observed, before, outcome, now, retainedSince)) {
            tx.setRollbackOnly();
            return TransitionResult.duplicate(accountKey, caseId, observed, dedupKey);
        }

        if (outcome == TransitionOutcome.REJECTED_INVALID_EDGE || before == observed) {
            return new TransitionResult(outcome, accountKey, caseId, before, observed, false, dedupKey, conversation.id(), null);
        }

        if (!caseRepository.updateStatus(accountKey, caseId, observed, now, supportCase.version())) {
            throw new OptimisticLockingFailureException("support_case_version_changed");
        }

        if (observed == CaseStatus.RESOLVED) {
            conversationRepository.markResolved(conversation.id(), now);
        } else if (observed == CaseStatus.REOPENED) {
            conversationRepository.clearResolution(conversation.id());
        }

        // The case version makes the identity unique per applied change, even when an old key is replayed.
        var dispatchId = OutboundNotifier.dispatchId(DispatchKind.STATUS, dedupKey, String.valueOf(supportCase.version()));
        var context = new RenderContext(accountKey, caseId, supportCase.displayId());
        notifier.enqueue(dispatchId, conversation.id(), DispatchKind.STATUS, renderer.statusChanged(context, before, observed));

        return new TransitionResult(TransitionOutcome.APPLIED, accountKey, caseId, before, observed, true, dedupKey, conversation.id(), dispatchId);
    }

    private void report(TransitionResult r, TransitionSource source) {
        switch (r.outcome()) {
            case APPLIED -> {
                applied.increment();
                if (r.changed()) {
                    log.info("transition_applied account={} case={} source={} from={} to={} conversationId={}",
                            r.accountKey(), r.caseId(), source, r.before(), r.observed(), r.conversationId());
                } else {
                    log.debug("transition_unchanged account={} case={} source={} status={}",
                            r.accountKey(), r.caseId(), source, r.observed());
                }
            }
            case DUPLICATE_IGNORED -> {
                duplicates.increment();
                log.debug("transition_duplicate account={} case={} source={} observed={} dedupKey={}",
                        r.accountKey(), r.caseId(), source, r.observed(), r.dedupKey());
            }
            case REJECTED_INVALID_EDGE -> {
                rejected.increment();
                log.warn("transition_rejected account={} case={} source={} current={} observed={} conversationId={} dedupKey={}",
                        r.accountKey(), r.caseId(), source, r.before(), r.observed(), r.conversationId(), r.dedupKey());
            }
            case NOT_FOUND -> {
                notFound.increment();
                log.debug("transition_not_found account={} case={} source={} observed={}",
                        r.accountKey(), r.caseId(), source, r.observed());
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
