package com.casebridge.sync.cases.service;

import com.casebridge.sync.backend.RemoteCase;
import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.cases.model.DedupKeys;
import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.cases.repo.SupportCaseRepository;
import com.casebridge.sync.common.concurrent.KeyedLocks;
import com.casebridge.sync.notify.DispatchKind;
import com.casebridge.sync.notify.service.MessageRenderer;
import com.casebridge.sync.notify.service.OutboundNotifier;
import com.casebridge.sync.notify.service.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Forwards new case communications to the case's live conversation.
 *
 * "New" means created strictly after the case's communication watermark; the watermark only moves forward.
 * Messages that were posted from the chat side are not echoed back.
 */
@Service
public class CommunicationRelayService {

    private static final Logger log = LoggerFactory.getLogger(CommunicationRelayService.class);

    static final Duration NO_WATERMARK_LOOKBACK = Duration.ofMinutes(15);

    private final SupportCaseRepository caseRepository;
    private final ConversationRepository conversationRepository;
    private final KeyedLocks keyedLocks;
    private final TransactionTemplate transactionTemplate;
    private final OutboundNotifier notifier;
    private final MessageRenderer renderer;
    private final Clock clock;

    public CommunicationRelayService(
            SupportCaseRepository caseRepository,
            ConversationRepository conversationRepository,
            KeyedLocks keyedLocks,
            TransactionTemplate transactionTemplate,
            OutboundNotifier notifier,
            MessageRenderer renderer,
            Clock clock
    ) {
        this.caseRepository = caseRepository;
        this.conversationRepository = conversationRepository;
        this.keyedLocks = keyedLocks;
        this.transactionTemplate = transactionTemplate;
        this.notifier = notifier;
        this.renderer = renderer;
        this.clock = clock;
    }

    /**
     * @return number of communications enqueued for delivery
     */
    public int relay(String accountKey, RemoteCase remote) {
        if (remote == null || remote.communications().isEmpty()) return 0;
        var caseId = remote.caseId();

        var lockKey = CaseRegistryService.caseKey(accountKey, caseId);
        Integer relayed = notifier.deferDelivery(() -> keyedLocks.withLock(lockKey, () -> transactionTemplate.execute(status -> {
            var conversation = conversationRepository.findLiveByCase(accountKey, caseId).orElse(null);
            var supportCase = caseRepository.find(accountKey, caseId).orElse(null);
            if (conversation == null || supportCase == null) return 0;

            caseRepository.updateDisplayId(accountKey, caseId, remote.displayId());
            var displayId = remote.displayId() != null ? remote.displayId() : supportCase.displayId();
            var context = new RenderContext(accountKey, caseId, displayId);

            var watermark = supportCase.lastCommunicationAt() != null
                    ? supportCase.lastCommunicationAt()
                    : clock.instant().minus(NO_WATERMARK_LOOKBACK);

            var ordered = new ArrayList<>(remote.communications());
            ordered.sort(Comparator.comparing(RemoteCommunication::timeCreated));

            int count = 0;
            Instant newest = null;
            for (var c : ordered) {
                if (!c.timeCreated().isAfter(watermark)) continue;
                newest = c.timeCreated();
                if (isFromChat(c.body())) {
                    log.debug("communication_echo_skipped account={} case={} at={}", accountKey, caseId, c.timeCreated());
                    continue;
                }
                var dispatchId = OutboundNotifier.dispatchId(
                        DispatchKind.COMMUNICATION,
                        accountKey,
                        caseId,
                        c.timeCreated().toString(),
                        DedupKeys.sha256Hex(c.body() == null ? "" : c.body())
                );
                if (notifier.enqueue(dispatchId, conversation.id(), DispatchKind.COMMUNICATION, renderer.communication(context, c))) {
                    count++;
                }
            }
            if (newest != null) {
                caseRepository.advanceLastCommunicationAt(accountKey, caseId, newest);
            }
            return count;
        })));

        int n = relayed == null ? 0 : relayed;
        if (n > 0) {
            log.info("communications_relayed account={} case={} count={}", accountKey, caseId, n);
        }
        return n;
    }

    /**
     * Messages forwarded from the chat side carry a "[From ... via Lark]" prefix.
     */
    static boolean isFromChat(String body) {
        if (body == null) return false;
        return body.startsWith("[From ") && body.contains("via Lark]");
    }
}
