package com.casebridge.sync.poller.service;

import com.casebridge.sync.account.Account;
import com.casebridge.sync.account.AccountRegistry;
import com.casebridge.sync.backend.BackendCallException;
import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.backend.RemoteCase;
import com.casebridge.sync.cases.model.DedupKeys;
import com.casebridge.sync.cases.model.TransitionSource;
import com.casebridge.sync.cases.repo.ConversationRepository;
import com.casebridge.sync.cases.repo.SupportCaseRepository;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.cases.service.CommunicationRelayService;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.common.repo.AdvisoryLockRepository;
import com.casebridge.sync.credential.CredentialBroker;
import com.casebridge.sync.credential.CredentialLease;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Periodic reconciliation: reads the authoritative status of every live conversation's case and applies the
 * transitions push delivery missed (the backend never pushes plain status changes).
 *
 * Accounts are polled concurrently up to the configured fan-out. A failing or slow account only fails its own
 * slot of the cycle; it is retried on the next cycle.
 */
@Component
public class ReconciliationPoller {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPoller.class);

    private final AccountRegistry accountRegistry;
    private final ConversationRepository conversationRepository;
    private final SupportCaseRepository caseRepository;
    private final CredentialBroker credentialBroker;
    private final CaseBackend caseBackend;
    private final CaseRegistryService registry;
    private final CommunicationRelayService relayService;
    private final AdvisoryLockRepository lockRepository;
    private final Clock clock;

    private final int fanOut;
    private final int batchSize;
    private final Duration accountTimeout;
    private final Duration dedupWindow;
    private final ExecutorService executor;

    private final AtomicReference<PollCycleReport> lastCycle = new AtomicReference<>();

    private final Counter accountFailures;
    private final Timer cycleDuration;

    public ReconciliationPoller(
            AccountRegistry accountRegistry,
            ConversationRepository conversationRepository,
            SupportCaseRepository caseRepository,
            CredentialBroker credentialBroker,
            CaseBackend caseBackend,
            CaseRegistryService registry,
            CommunicationRelayService relayService,
            AdvisoryLockRepository lockRepository,
            Clock clock,
            SyncProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.accountRegistry = accountRegistry;
        this.conversationRepository = conversationRepository;
        this.caseRepository = caseRepository;
        this.credentialBroker = credentialBroker;
        this.caseBackend = caseBackend;
        this.registry = registry;
        this.relayService = relayService;
        this.lockRepository = lockRepository;
        this.clock = clock;

        this.fanOut = properties.pollFanOut();
        this.batchSize = properties.scanBatchSize();
        this.accountTimeout = properties.pollAccountTimeout();
        this.dedupWindow = properties.dedupWindow();

        var threadSeq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(fanOut, r -> {
            var t = new Thread(r, "case-poller-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.accountFailures = Counter.builder("casebridge.poll.account_failures")
                .description("Accounts whose poll failed or timed out")
                .register(meterRegistry);
        this.cycleDuration = Timer.builder("casebridge.poll.cycle.duration")
                .description("Wall-clock time of one reconciliation cycle")
                .register(meterRegistry);
    }

    @Scheduled(
            fixedDelayString = "${app.sync.poll-interval-ms:600000}",
            initialDelayString = "${app.sync.scheduler-initial-delay-ms:30000}"
    )
    public void poll() {
        try {
            var ran = lockRepository.runExclusive("reconciliation_poll", this::runCycle);
            if (!ran) {
                log.debug("poll_cycle_skipped_locked");
            }
        } catch (Exception e) {
            log.warn("poll_cycle_failed", e);
        }
    }

    public Optional<PollCycleReport> lastCycle() {
        return Optional.ofNullable(lastCycle.get());
    }

    public PollCycleReport runCycle() {
        var startedAt = clock.instant();
        long startNanos = System.nanoTime();

        var accounts = accountRegistry.list();
        var futures = new LinkedHashMap<String, Future<AccountPollResult>>();
        for (var account : accounts) {
            futures.put(account.key(), executor.submit(() -> pollAccount(account)));
        }

        // Queued accounts wait for a free slot, so the cycle budget grows with the number of waves.
        int waves = Math.max(1, (accounts.size() + fanOut - 1) / fanOut);
        long deadlineNanos = startNanos + accountTimeout.toNanos() * waves;

        var results = new ArrayList<AccountPollResult>();
        for (var entry : futures.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue(), deadlineNanos, startNanos));
        }

        long elapsedNanos = System.nanoTime() - startNanos;
        cycleDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);

        var report = new PollCycleReport(startedAt, clock.instant(), results);
        lastCycle.set(report);
        log.info("poll_cycle accounts={} applied={} failedAccounts={} durationMs={}",
                accounts.size(), report.transitionsApplied(), report.failedAccounts(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        return report;
    }

    private AccountPollResult await(String accountKey, Future<AccountPollResult> future, long deadlineNanos, long startNanos) {
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            var result = future.get(remaining, TimeUnit.NANOSECONDS);
            if (result.status() != AccountPollResult.Status.OK) {
                accountFailures.increment();
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            accountFailures.increment();
            log.warn("poll_account_timed_out account={}", accountKey);
            return AccountPollResult.timedOut(accountKey, millisSince(startNanos));
        } catch (ExecutionException e) {
            // pollAccount converts its own failures; reaching this means an Error escaped.
            accountFailures.increment();
            log.warn("poll_account_crashed account={}", accountKey, e.getCause());
            return AccountPollResult.failed(accountKey, String.valueOf(e.getCause()), millisSince(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return AccountPollResult.failed(accountKey, "interrupted", millisSince(startNanos));
        }
    }

    AccountPollResult pollAccount(Account account) {
        var accountKey = account.key();
        long startNanos = System.nanoTime();
        long budgetEnd = startNanos + accountTimeout.toNanos();

        int checked = 0;
        int applied = 0;
        int relayed = 0;
        int caseFailures = 0;
        try {
            var credential = credentialBroker.getCredential(accountKey);
            String afterId = null;
            while (true) {
                if (Thread.currentThread().isInterrupted() || System.nanoTime() > budgetEnd) {
                    throw new TimeoutException("poll_account_budget_exhausted");
                }
                var page = conversationRepository.listLiveByAccount(accountKey, afterId, batchSize);
                if (page.isEmpty()) break;

                var caseIds = page.stream().map(ConversationRepository.LiveCaseRow::caseId).distinct().toList();
                var holder = new CredentialHolder(credential);
                var remoteById = describe(accountKey, holder, caseIds).stream()
                        .collect(Collectors.toMap(RemoteCase::caseId, Function.identity(), (a, b) -> a));
                credential = holder.lease;

                for (var row : page) {
                    var remote = remoteById.get(row.caseId());
                    if (remote == null) {
                        log.debug("poll_case_missing account={} case={}", accountKey, row.caseId());
                        continue;
                    }
                    checked++;
                    try {
                        if (reconcile(accountKey, remote)) applied++;
                        relayed += relayService.relay(accountKey, remote);
                    } catch (Exception e) {
                        caseFailures++;
                        log.warn("poll_case_failed account={} case={}", accountKey, row.caseId(), e);
                    }
                }

                afterId = page.get(page.size() - 1).conversationId();
                if (page.size() < batchSize) break;
            }

            long ms = millisSince(startNanos);
            log.debug("poll_account_done account={} checked={} applied={} relayed={} durationMs={}",
                    accountKey, checked, applied, relayed, ms);
            return new AccountPollResult(accountKey, AccountPollResult.Status.OK, checked, applied, relayed, caseFailures, null, ms);
        } catch (Exception e) {
            // Failures are counted once, by the cycle that reads this result.
            if (Thread.currentThread().isInterrupted()) {
                log.debug("poll_account_cancelled account={} checked={}", accountKey, checked);
                return AccountPollResult.timedOut(accountKey, millisSince(startNanos));
            }
            if (e instanceof TimeoutException) {
                log.warn("poll_account_budget_exhausted account={} checked={} applied={}", accountKey, checked, applied);
                return new AccountPollResult(accountKey, AccountPollResult.Status.TIMED_OUT, checked, applied, relayed,
                        caseFailures, "poll_account_timeout", millisSince(startNanos));
            }
            log.warn("poll_account_failed account={} checked={} applied={} reason={}", accountKey, checked, applied, e.getMessage());
            return new AccountPollResult(accountKey, AccountPollResult.Status.FAILED, checked, applied, relayed, caseFailures,
                    e.getMessage(), millisSince(startNanos));
        }
    }

    /**
     * Applies a POLL transition when the backend status differs from the recorded one.
     */
    private boolean reconcile(String accountKey, RemoteCase remote) {
        var local = caseRepository.find(accountKey, remote.caseId()).orElse(null);
        if (local == null || local.status() == remote.status()) return false;

        var dedupKey = DedupKeys.forObservation(accountKey, remote.caseId(), remote.status(), clock.instant(), dedupWindow);
        var result = registry.applyTransition(accountKey, remote.caseId(), remote.status(), TransitionSource.POLL, dedupKey);
        return result.applied() && result.changed();
    }

    /**
     * One retry with a fresh lease when the backend rejects the cached credential.
     */
    private List<RemoteCase> describe(String accountKey, CredentialHolder holder, List<String> caseIds) {
        try {
            return caseBackend.describeCases(holder.lease, caseIds, true);
        } catch (BackendCallException e) {
            if (!e.credentialRejected()) throw e;
            credentialBroker.invalidate(accountKey, holder.lease);
            holder.lease = credentialBroker.getCredential(accountKey);
            return caseBackend.describeCases(holder.lease, caseIds, true);
        }
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class CredentialHolder {
        private CredentialLease lease;

        private CredentialHolder(CredentialLease lease) {
            this.lease = lease;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
