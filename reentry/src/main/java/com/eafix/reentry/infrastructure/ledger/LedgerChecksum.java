package com.eafix.reentry.infrastructure.ledger;

import com.eafix.reentry.domain.ledger.LedgerSchema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Row checksum shared with every other ledger reader and writer.
 *
 * Field names except {@code checksum_sha256} are sorted lexicographically, their string
 * values joined with {@code |}, and the UTF-8 bytes hashed with SHA-256 (lowercase hex).
 */
public final class LedgerChecksum {
    private static final String SEPARATOR = "|";

    private LedgerChecksum() {}

    public static String compute(Map<String, String> row) {
        String payload = new TreeMap<>(row).entrySet().stream()
            .filter(e -> !LedgerSchema.CHECKSUM.equals(e.getKey()))
            .map(e -> e.getValue() != null ? e.getValue() : "")
            .collect(Collectors.joining(SEPARATOR));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * @return true if the row's {@code checksum_sha256} matches its other fields
     */
    public static boolean verify(Map<String, String> row) {
        String recorded = row.get(LedgerSchema.CHECKSUM);
        return recorded != null && recorded.equals(compute(row));
    }
}
