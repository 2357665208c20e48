package com.casebridge.sync.support;

import com.casebridge.sync.account.Account;
import com.casebridge.sync.credential.CredentialLease;
import com.casebridge.sync.credential.ExchangeFailedException;
import com.casebridge.sync.credential.IdentityExchange;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeIdentityExchange implements IdentityExchange {

    private final Clock clock;
    private final AtomicInteger calls = new AtomicInteger();
    private final ConcurrentHashMap<String, AtomicInteger> callsByAccount = new ConcurrentHashMap<>();
    private final Set<String> failingAccounts = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch gate;
    private volatile Duration leaseLifetime = Duration.ofHours(1);

    public FakeIdentityExchange(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CredentialLease exchange(Account account, Duration timeout) {
        calls.incrementAndGet();
        callsByAccount.computeIfAbsent(account.key(), k -> new AtomicInteger()).incrementAndGet();

        var g = gate;
        if (g != null) {
            try {
                if (!g.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new ExchangeFailedException(account.key(), "exchange_timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExchangeFailedException(account.key(), "exchange_interrupted", e);
            }
        }
        if (failingAccounts.contains(account.key())) {
            throw new ExchangeFailedException(account.key(), "injected_exchange_failure");
        }
        var issuedAt = clock.instant();
        int n = calls.get();
        return new CredentialLease(account.key(), "AKIA" + n, "secret-" + n, "token-" + n, issuedAt, issuedAt.plus(leaseLifetime));
    }

    public int calls() {
        return calls.get();
    }

    public int calls(String accountKey) {
        var c = callsByAccount.get(accountKey);
        return c == null ? 0 : c.get();
    }

    public void failFor(String accountKey) {
        failingAccounts.add(accountKey);
    }

    public void holdUntilReleased(CountDownLatch latch) {
        this.gate = latch;
    }

    public void setLeaseLifetime(Duration leaseLifetime) {
        this.leaseLifetime = leaseLifetime;
    }

    public void reset() {
        calls.set(0);
        callsByAccount.clear();
        failingAccounts.clear();
        gate = null;
        leaseLifetime = Duration.ofHours(1);
    }
}
