package com.casebridge.sync.cases.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Dedup keys for transitions: one key per (account, case, status, time bucket).
 */
public final class DedupKeys {

    private DedupKeys() {
    }

    public static String forObservation(String accountKey, String caseId, CaseStatus status, Instant observedAt, Duration window) {
        long windowSeconds = Math.max(1, window.toSeconds());
        long bucket = Math.floorDiv(observedAt.getEpochSecond(), windowSeconds);
        return sha256Hex(accountKey + "|" + caseId + "|" + status.name() + "|" + bucket);
    }

    public static String sha256Hex(String value) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("sha256_unavailable", e);
        }
    }
}
