package com.casebridge.sync.lifecycle;

import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.common.repo.AdvisoryLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Scans resolved, live conversations: warns once the warning threshold passes and archives once the grace period
 * has fully elapsed.
 */
@Component
public class LifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleScheduler.class);

    public record ScanResult(int scanned, int warned, int archived, int failed) {
    }

    private final ConversationRepository conversationRepository;
    private final ConversationLifecycleService lifecycleService;
    private final AdvisoryLockRepository lockRepository;
    private final Clock clock;
    private final int batchSize;

    public LifecycleScheduler(
            ConversationRepository conversationRepository,
            ConversationLifecycleService lifecycleService,
            AdvisoryLockRepository lockRepository,
            Clock clock,
            SyncProperties properties
    ) {
        this.conversationRepository = conversationRepository;
        this.lifecycleService = lifecycleService;
        this.lockRepository = lockRepository;
        this.clock = clock;
        this.batchSize = properties.scanBatchSize();
    }

    @Scheduled(
            fixedDelayString = "${app.sync.lifecycle-scan-interval-ms:60000}",
            initialDelayString = "${app.sync.scheduler-initial-delay-ms:30000}"
    )
    public void scan() {
        try {
            lockRepository.runExclusive("lifecycle_scan", this::scanOnce);
        } catch (Exception e) {
            log.warn("lifecycle_scan_failed", e);
        }
    }

    public ScanResult scanOnce() {
        var now = clock.instant();
        var cutoff = now.minus(lifecycleService.warningThreshold());

        int scanned = 0;
        int warned = 0;
        int archived = 0;
        int failed = 0;
        String afterId = null;
        while (true) {
            var page = conversationRepository.listResolvedCandidates(cutoff, afterId, batchSize);
            if (page.isEmpty()) break;

            for (var row : page) {
                scanned++;
                try {
                    var elapsed = Duration.between(row.resolvedAt(), now);
                    if (elapsed.compareTo(lifecycleService.gracePeriod()) >= 0) {
                        if (lifecycleService.archiveIfDue(row.conversationId(), now)) archived++;
                    } else if (row.warnedAt() == null) {
                        if (lifecycleService.warnIfDue(row.conversationId(), now)) warned++;
                    }
                } catch (Exception e) {
                    failed++;
                    log.warn("lifecycle_row_failed conversationId={} account={} case={}",
                            row.conversationId(), row.accountKey(), row.caseId(), e);
                }
            }

            afterId = page.get(page.size() - 1).conversationId();
            if (page.size() < batchSize) break;
        }

        if (warned > 0 || archived > 0 || failed > 0) {
            log.info("lifecycle_scan scanned={} warned={} archived={} failed={}", scanned, warned, archived, failed);
        }
        return new ScanResult(scanned, warned, archived, failed);
    }
}
