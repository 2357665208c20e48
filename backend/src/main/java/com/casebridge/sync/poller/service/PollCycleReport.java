package com.casebridge.sync.poller.service;

import java.time.Instant;
import java.util.List;

public record PollCycleReport(Instant startedAt, Instant finishedAt, List<AccountPollResult> accounts) {

    public PollCycleReport {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public int transitionsApplied() {
        return accounts.stream().mapToInt(AccountPollResult::transitionsApplied).sum();
    }

    public long failedAccounts() {
        return accounts.stream().filter(a -> a.status() != AccountPollResult.Status.OK).count();
    }

    public AccountPollResult forAccount(String accountKey) {
        return accounts.stream().filter(a -> a.accountKey().equals(accountKey)).findFirst().orElse(null);
    }
}
