package com.casebridge.sync.notify.service;

import com.casebridge.sync.common.repo.AdvisoryLockRepository;
import com.casebridge.sync.notify.repo.OutboundDispatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Retries pending outbound dispatches whose backoff has elapsed.
 */
@Component
public class OutboundDispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(OutboundDispatchScheduler.class);

    private final OutboundDispatchRepository dispatchRepository;
    private final OutboundNotifier notifier;
    private final AdvisoryLockRepository lockRepository;
    private final Clock clock;
    private final int batchSize;

    public OutboundDispatchScheduler(
            OutboundDispatchRepository dispatchRepository,
            OutboundNotifier notifier,
            AdvisoryLockRepository lockRepository,
            Clock clock,
            @Value("${app.sync.outbox-batch-size:50}") int batchSize
    ) {
        this.dispatchRepository = dispatchRepository;
        this.notifier = notifier;
        this.lockRepository = lockRepository;
        this.clock = clock;
        this.batchSize = Math.max(1, Math.min(batchSize, 500));
    }

    @Scheduled(
            fixedDelayString = "${app.sync.outbox-sweep-interval-ms:15000}",
            initialDelayString = "${app.sync.scheduler-initial-delay-ms:30000}"
    )
    public void sweep() {
        try {
            lockRepository.runExclusive("outbox_sweep", this::sweepOnce);
        } catch (Exception e) {
            log.warn("outbox_sweep_lock_failed", e);
        }
    }

    /**
     * @return number of dispatches delivered in this pass
     */
    public int sweepOnce() {
        int delivered = 0;
        int attempted = 0;
        try {
            for (var id : dispatchRepository.listDueIds(clock.instant(), batchSize)) {
                attempted++;
                try {
                    if (notifier.dispatchNow(id)) delivered++;
                } catch (Exception e) {
                    log.warn("outbox_dispatch_failed dispatchId={}", id, e);
                }
            }
        } catch (Exception e) {
            log.warn("outbox_sweep_failed", e);
        }
        if (attempted > 0) {
            log.info("outbox_sweep attempted={} delivered={}", attempted, delivered);
        }
        return delivered;
    }
}
