package com.company.consolidation.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic ids for consolidated alerts, derived from the member set so
 * that re-running a batch over the same members converges on one record.
 */
public class ConsolidatedAlertIds {

    public static final String PREFIX = "consolidated-";

    private static final int HASH_CHARS = 16;

    public static String forMembers(Collection<String> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("Consolidated alert needs at least one member id");
        }

        List<String> sorted = memberIds.stream().sorted().distinct().toList();
        String key = String.join(",", sorted);

        return PREFIX + HexFormat.of().formatHex(sha256(key)).substring(0, HASH_CHARS);
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
