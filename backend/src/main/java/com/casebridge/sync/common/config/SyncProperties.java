package com.casebridge.sync.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the synchronization engine.
 *
 * Scheduling periods live next to these keys as plain millisecond values ({@code *-interval-ms})
 * because they feed {@code @Scheduled} directly.
 */
@ConfigurationProperties(prefix = "app.sync")
public record SyncProperties(
        Duration gracePeriod,
        Duration warningLeadTime,
        Duration dedupWindow,
        Duration renewalSafetyMargin,
        Duration transitionRetention,
        Integer pollFanOut,
        Duration pollAccountTimeout,
        Integer scanBatchSize,
        Duration exchangeTimeout,
        Integer outboxMaxAttempts
) {

    public SyncProperties {
        gracePeriod = clamp(gracePeriod, Duration.ofHours(72), Duration.ofMinutes(1), Duration.ofDays(365));
        warningLeadTime = clamp(warningLeadTime, Duration.ofHours(1), Duration.ZERO, Duration.ofDays(365));
        if (warningLeadTime.compareTo(gracePeriod) >= 0) {
            warningLeadTime = gracePeriod.dividedBy(2);
        }
        dedupWindow = clamp(dedupWindow, Duration.ofMinutes(5), Duration.ofSeconds(1), Duration.ofDays(1));
        renewalSafetyMargin = clamp(renewalSafetyMargin, Duration.ofMinutes(5), Duration.ZERO, Duration.ofHours(12));
        transitionRetention = clamp(transitionRetention, Duration.ofMinutes(30), Duration.ofMinutes(1), Duration.ofDays(30));
        if (transitionRetention.compareTo(dedupWindow.multipliedBy(2)) < 0) {
            transitionRetention = dedupWindow.multipliedBy(2);
        }
        pollFanOut = clampInt(pollFanOut, 4, 1, 64);
        pollAccountTimeout = clamp(pollAccountTimeout, Duration.ofMinutes(2), Duration.ofSeconds(1), Duration.ofHours(1));
        scanBatchSize = clampInt(scanBatchSize, 100, 1, 100);
        exchangeTimeout = clamp(exchangeTimeout, Duration.ofSeconds(10), Duration.ofMillis(100), Duration.ofMinutes(5));
        outboxMaxAttempts = clampInt(outboxMaxAttempts, 10, 1, 100);
    }

    private static Duration clamp(Duration value, Duration fallback, Duration min, Duration max) {
        if (value == null) return fallback;
        if (value.compareTo(min) < 0) return min;
        if (value.compareTo(max) > 0) return max;
        return value;
    }

    private static int clampInt(Integer value, int fallback, int min, int max) {
        if (value == null) return fallback;
        return Math.max(min, Math.min(value, max));
    }
}
