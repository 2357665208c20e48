package com.casebridge.sync.poller.service;

/**
 * Outcome of one account within a poll cycle.
 */
public record AccountPollResult(
        String accountKey,
        Status status,
        int casesChecked,
        int transitionsApplied,
        int communicationsRelayed,
        int caseFailures,
        String error,
        long durationMs
) {

    public enum Status {
        OK,
        FAILED,
        TIMED_OUT
    }

    public static AccountPollResult failed(String accountKey, String error, long durationMs) {
        return new AccountPollResult(accountKey, Status.FAILED, 0, 0, 0, 0, error, durationMs);
    }

    public static AccountPollResult timedOut(String accountKey, long durationMs) {
        return new AccountPollResult(accountKey, Status.TIMED_OUT, 0, 0, 0, 0, "poll_account_timeout", durationMs);
    }
}
