package com.truthbus.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable key for "the same fact": (subject, metric, time bucket).
 *
 * Callers own normalization; two identities are equal only when all three
 * components match exactly.
 */
public record ClaimIdentity(
    @JsonProperty("subject") String subject,
    @JsonProperty("metric") String metric,
    @JsonProperty("time_bucket") String timeBucket
) {

    public String canonicalKey() {
        return subject + "|" + metric + "|" + timeBucket;
    }

    /**
     * Deterministic vector id: SHA-256 hex of the canonical key.
     */
    public String vectorId() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalKey().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    @Override
    public String toString() {
        return canonicalKey();
    }
}
