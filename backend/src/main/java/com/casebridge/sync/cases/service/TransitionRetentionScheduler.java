package com.casebridge.sync.cases.service;

import com.casebridge.sync.cases.repo.CaseTransitionRepository;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.common.repo.AdvisoryLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
public class TransitionRetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(TransitionRetentionScheduler.class);

    private final CaseTransitionRepository transitionRepository;
    private final AdvisoryLockRepository lockRepository;
    private final Clock clock;
    private final Duration retention;

    public TransitionRetentionScheduler(
            CaseTransitionRepository transitionRepository,
            AdvisoryLockRepository lockRepository,
            Clock clock,
            SyncProperties properties
    ) {
        this.transitionRepository = transitionRepository;
        this.lockRepository = lockRepository;
        this.clock = clock;
        this.retention = properties.transitionRetention();
    }

    @Scheduled(
            fixedDelayString = "${app.sync.retention-sweep-interval-ms:300000}",
            initialDelayString = "${app.sync.scheduler-initial-delay-ms:30000}"
    )
    public void purgeExpiredTransitions() {
        try {
            lockRepository.runExclusive("transition_retention", this::purgeOnce);
        } catch (Exception e) {
            log.warn("transition_retention_failed", e);
        }
    }

    public int purgeOnce() {
        var cutoff = clock.instant().minus(retention);
        int purged = transitionRepository.purgeOlderThan(cutoff);
        if (purged > 0) {
            log.info("transition_retention purged={} cutoff={}", purged, cutoff);
        }
        return purged;
    }
}
