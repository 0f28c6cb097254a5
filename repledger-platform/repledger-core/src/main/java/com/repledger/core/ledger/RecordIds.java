package com.repledger.core.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.StringJoiner;

/**
 * Deterministic record identifiers. Replaying the same inputs yields the same id, which is what
 * makes rating submission and dispute initiation idempotent.
 */
public final class RecordIds {

    public static final String RATING_PREFIX = "RAT-";
    public static final String DISPUTE_PREFIX = "DIS-";

    private static final int ID_BYTES = 8;
    private static final String SEPARATOR = ":";

    private RecordIds() {
    }

    public static String ratingId(String raterId, String targetId, String dimension, long epochSeconds) {
        return RATING_PREFIX + digest(join(raterId, targetId, dimension, Long.toString(epochSeconds)));
    }

    public static String disputeId(String ratingId, String initiatorId) {
        return DISPUTE_PREFIX + digest(join(ratingId, initiatorId));
    }

    /**
     * Colon-joined parts. Each part has {@code %} and {@code :} percent-escaped so distinct part
     * lists never share hash material; parts without either character are used as they are.
     */
    static String join(String... parts) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (String part : parts) {
            joiner.add(part.replace("%", "%25").replace(SEPARATOR, "%3A"));
        }
        return joiner.toString();
    }

    private static String digest(String material) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(Arrays.copyOf(hash, ID_BYTES));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
