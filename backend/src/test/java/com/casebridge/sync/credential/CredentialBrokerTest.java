package com.casebridge.sync.credential;

import com.casebridge.sync.account.AccountNotFoundException;
import com.casebridge.sync.account.AccountProperties;
import com.casebridge.sync.account.AccountRegistry;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.support.FakeIdentityExchange;
import com.casebridge.sync.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialBrokerTest {

    private MutableClock clock;
    private FakeIdentityExchange exchange;
    private CredentialBroker broker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        exchange = new FakeIdentityExchange(clock);
        var accounts = new AccountRegistry(new AccountProperties(List.of(
                new AccountProperties.Entry("acct-0", "arn:aws:iam::000000000000:role/R", "zero", null),
                new AccountProperties.Entry("acct-1", "arn:aws:iam::111111111111:role/R", "one", null)
        )));
        var props = new SyncProperties(null, null, null, Duration.ofMinutes(5), null, null, null, null, Duration.ofSeconds(2), null);
        broker = new CredentialBroker(accounts, exchange, clock, props, new SimpleMeterRegistry());
    }

    @Test
    void cached_lease_is_reused_until_safety_margin() {
        var first = broker.getCredential("acct-0");
        clock.advance(Duration.ofMinutes(54));
        assertSame(first, broker.getCredential("acct-0"));
        assertEquals(1, exchange.calls());

        // 55 minutes into a one-hour lease is inside the five-minute margin.
        clock.advance(Duration.ofMinutes(1));
        var second = broker.getCredential("acct-0");
        assertNotSame(first, second);
        assertEquals(2, exchange.calls());
    }

    @Test
    void concurrent_callers_share_one_exchange() throws Exception {
        var gate = new CountDownLatch(1);
        exchange.holdUntilReleased(gate);

        int callers = 16;
        var pool = Executors.newFixedThreadPool(callers);
        try {
            var futures = new ArrayList<Future<CredentialLease>>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> broker.getCredential("acct-0")));
            }
            // Let every caller reach the broker before the single exchange completes.
            Thread.sleep(200);
            gate.countDown();

            var leases = new ArrayList<CredentialLease>();
            for (var f : futures) leases.add(f.get(5, TimeUnit.SECONDS));

            assertEquals(1, exchange.calls());
            for (var lease : leases) {
                assertSame(leases.get(0), lease);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unrelated_accounts_renew_independently() {
        var a = broker.getCredential("acct-0");
        var b = broker.getCredential("acct-1");
        assertEquals("acct-0", a.accountKey());
        assertEquals("acct-1", b.accountKey());
        assertEquals(1, exchange.calls("acct-0"));
        assertEquals(1, exchange.calls("acct-1"));
    }

    @Test
    void failure_reaches_every_waiter_and_is_not_retried() throws Exception {
        exchange.failFor("acct-0");
        var gate = new CountDownLatch(1);
        exchange.holdUntilReleased(gate);

        var pool = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<CredentialLease>>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> broker.getCredential("acct-0")));
            }
            Thread.sleep(200);
            gate.countDown();

            for (var f : futures) {
                var ex = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
                assertInstanceOf(ExchangeFailedException.class, ex.getCause());
            }
            assertEquals(1, exchange.calls());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unknown_account_fails_without_exchange() {
        var ex = assertThrows(AccountNotFoundException.class, () -> broker.getCredential("acct-missing"));
        assertEquals("acct-missing", ex.accountKey());
        assertEquals(0, exchange.calls());
    }

    @Test
    void invalidate_forces_renewal() {
        var first = broker.getCredential("acct-0");
        broker.invalidate("acct-0", first);
        var second = broker.getCredential("acct-0");
        assertNotSame(first, second);
        assertEquals(2, exchange.calls());
    }

    @Test
    void margin_is_capped_at_half_the_lease_lifetime() {
        exchange.setLeaseLifetime(Duration.ofMinutes(8));
        var lease = broker.getCredential("acct-0");
        // A five-minute margin on an eight-minute lease would leave three minutes; the cap keeps four.
        clock.advance(Duration.ofMinutes(3).plusSeconds(30));
        assertTrue(lease.usableAt(clock.instant(), Duration.ofMinutes(5)));
        assertSame(lease, broker.getCredential("acct-0"));
    }
}
