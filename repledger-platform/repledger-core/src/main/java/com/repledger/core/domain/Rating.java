package com.repledger.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a single rating event. The weight is the rater weight in force when the
 * rating was submitted, so a later reversal subtracts exactly what was added.
 */
public record Rating(
        String ratingId,
        String raterId,
        String targetId,
        String dimension,
        double value,
        double weight,
        String evidenceRef,
        Instant timestamp,
        String txId
) {

    public boolean isPositive() {
        return value >= 0.5;
    }

    /**
     * Evidence this rating contributed to alpha (positive) or beta (negative).
     */
    public double contribution() {
        return isPositive() ? weight * value : weight * (1.0 - value);
    }

    public boolean sameContentAs(Rating other) {
        return raterId.equals(other.raterId)
                && targetId.equals(other.targetId)
                && dimension.equals(other.dimension)
                && Double.compare(value, other.value) == 0
                && Objects.equals(evidenceRef, other.evidenceRef)
                && timestamp.equals(other.timestamp);
    }
}
