package com.casebridge.sync.credential;

import com.casebridge.sync.account.Account;

import java.time.Duration;

/**
 * Upstream identity exchange: trades the caller's own identity for a credential scoped to {@code account}.
 */
public interface IdentityExchange {

    /**
     * @throws ExchangeFailedException when the exchange is rejected, fails or exceeds {@code timeout}
     */
    CredentialLease exchange(Account account, Duration timeout);
}
