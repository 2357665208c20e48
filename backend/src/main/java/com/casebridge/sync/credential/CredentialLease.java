package com.casebridge.sync.credential;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-limited credential for one account. Held in memory only.
 */
public record CredentialLease(
        String accountKey,
        String accessKeyId,
        String secretAccessKey,
        String sessionToken,
        Instant issuedAt,
        Instant expiresAt
) {

    public Duration lifetime() {
        if (issuedAt == null || expiresAt == null || !expiresAt.isAfter(issuedAt)) {
            return Duration.ZERO;
        }
        return Duration.between(issuedAt, expiresAt);
    }

    /**
     * Usable while {@code now < expiresAt - margin}; the margin never exceeds half the lease lifetime.
     */
    public boolean usableAt(Instant now, Duration safetyMargin) {
        if (expiresAt == null) return false;
        var half = lifetime().dividedBy(2);
        var margin = safetyMargin.compareTo(half) > 0 ? half : safetyMargin;
        return now.isBefore(expiresAt.minus(margin));
    }

    @Override
    public String toString() {
        return "CredentialLease[accountKey=" + accountKey + ", accessKeyId=" + accessKeyId
                + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
