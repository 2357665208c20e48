package com.casebridge.sync.credential;

import com.casebridge.sync.account.AccountRegistry;
import com.casebridge.sync.common.config.SyncProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands out per-account credentials, renewing them through the {@link IdentityExchange} only when the cached
 * lease is inside its safety margin.
 *
 * Concurrent renewals for one account collapse into a single exchange call; every waiter observes the same lease
 * or the same failure. The broker never retries: retry policy belongs to the caller.
 */
@Service
public class CredentialBroker {

    private static final Logger log = LoggerFactory.getLogger(CredentialBroker.class);

    private final AccountRegistry accountRegistry;
    private final IdentityExchange identityExchange;
    private final Clock clock;
    private final Duration safetyMargin;
    private final Duration exchangeTimeout;

    private final ConcurrentHashMap<String, CredentialLease> leases = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<CredentialLease>> renewals = new ConcurrentHashMap<>();

    private final Counter exchanges;
    private final Counter exchangeFailures;

    public CredentialBroker(
            AccountRegistry accountRegistry,
            IdentityExchange identityExchange,
            Clock clock,
            SyncProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.accountRegistry = accountRegistry;
        this.identityExchange = identityExchange;
        this.clock = clock;
        this.safetyMargin = properties.renewalSafetyMargin();
        this.exchangeTimeout = properties.exchangeTimeout();

        this.exchanges = Counter.builder("casebridge.credential.exchanges")
                .description("Identity exchange calls issued by the broker")
                .register(meterRegistry);
        this.exchangeFailures = Counter.builder("casebridge.credential.exchange_failures")
                .description("Identity exchange calls that failed")
                .register(meterRegistry);
    }

    /**
     * @throws com.casebridge.sync.account.AccountNotFoundException when the account is not configured
     * @throws ExchangeFailedException when renewal fails or times out
     */
    public CredentialLease getCredential(String accountKey) {
        var account = accountRegistry.require(accountKey);

        var cached = leases.get(accountKey);
        if (cached != null && cached.usableAt(clock.instant(), safetyMargin)) {
            return cached;
        }

        var mine = new CompletableFuture<CredentialLease>();
        var inFlight = renewals.putIfAbsent(accountKey, mine);
        if (inFlight != null) {
            return awaitRenewal(accountKey, inFlight);
        }

        try {
            // A renewal may have finished between the cache read and winning the slot.
            var fresh = leases.get(accountKey);
            if (fresh != null && fresh.usableAt(clock.instant(), safetyMargin)) {
                mine.complete(fresh);
                return fresh;
            }

            exchanges.increment();
            var lease = identityExchange.exchange(account, exchangeTimeout);
            if (lease == null || lease.expiresAt() == null) {
                throw new ExchangeFailedException(accountKey, "exchange_returned_no_credential");
            }
            leases.put(accountKey, lease);
            mine.complete(lease);
            log.info("credential_renewed account={} expiresAt={}", accountKey, lease.expiresAt());
            return lease;
        } catch (RuntimeException e) {
            exchangeFailures.increment();
            var failure = e instanceof ExchangeFailedException efe
                    ? efe
                    : new ExchangeFailedException(accountKey, "exchange_failed", e);
            mine.completeExceptionally(failure);
            log.warn("credential_exchange_failed account={} reason={}", accountKey, failure.getMessage());
            throw failure;
        } finally {
            renewals.remove(accountKey, mine);
        }
    }

    /**
     * Drops the cached lease, e.g. after the backend rejected it as expired.
     */
    public void invalidate(String accountKey, CredentialLease rejected) {
        if (accountKey == null) return;
        if (rejected == null) {
            leases.remove(accountKey);
        } else {
            leases.remove(accountKey, rejected);
        }
        log.info("credential_invalidated account={}", accountKey);
    }

    private CredentialLease awaitRenewal(String accountKey, CompletableFuture<CredentialLease> inFlight) {
        try {
            // The owner's exchange is itself bounded by exchangeTimeout; allow it to finish before giving up.
            return inFlight.get(exchangeTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ExchangeFailedException efe) {
                throw efe;
            }
            throw new ExchangeFailedException(accountKey, "exchange_failed", e.getCause());
        } catch (TimeoutException e) {
            throw new ExchangeFailedException(accountKey, "exchange_wait_timeout", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeFailedException(accountKey, "exchange_wait_interrupted", e);
        }
    }
}
