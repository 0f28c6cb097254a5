package com.repledger.core.domain;

import java.time.Instant;

/**
 * Heuristic flag raised against a rating at submission time, kept for later analysis.
 */
public record SuspiciousRating(
        String ratingId,
        Type type,
        String raterId,
        String targetId,
        String dimension,
        double value,
        double confidence,
        String description,
        Instant detectedAt
) {

    public enum Type {
        POTENTIAL_SYBIL
    }
}
