package com.casebridge.sync.poller.api;

import com.casebridge.sync.poller.service.PollCycleReport;

import java.util.List;

public record PollCycleView(
        long started_at,
        long finished_at,
        int transitions_applied,
        long failed_accounts,
        List<AccountView> accounts
) {

    public record AccountView(
            String account_key,
            String status,
            int cases_checked,
            int transitions_applied,
            int communications_relayed,
            int case_failures,
            String error,
            long duration_ms
    ) {
    }

    public static PollCycleView of(PollCycleReport report) {
        var accounts = report.accounts().stream()
                .map(a -> new AccountView(
                        a.accountKey(),
                        a.status().name(),
                        a.casesChecked(),
                        a.transitionsApplied(),
                        a.communicationsRelayed(),
                        a.caseFailures(),
                        a.error(),
                        a.durationMs()
                ))
                .toList();
        return new PollCycleView(
                report.startedAt().getEpochSecond(),
                report.finishedAt().getEpochSecond(),
                report.transitionsApplied(),
                report.failedAccounts(),
                accounts
        );
    }
}
