package com.repledger.core.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Challenge raised by the target of a rating. Rater, target and dimension are copied from the
 * rating for audit; lockedCost is what was actually locked from the initiator so the refund is
 * exact even if the configured cost changes meanwhile.
 */
public record Dispute(
        String disputeId,
        String ratingId,
        String initiatorId,
        String raterId,
        String targetId,
        String dimension,
        String reason,
        DisputeStatus status,
        String arbitratorId,
        String resolutionNotes,
        BigDecimal lockedCost,
        BigDecimal slashedAmount,
        Instant createdAt,
        Instant resolvedAt
) {

    public static Dispute open(String disputeId, Rating rating, String initiatorId, String reason,
                               BigDecimal lockedCost, Instant now) {
        return new Dispute(disputeId, rating.ratingId(), initiatorId, rating.raterId(), rating.targetId(),
                rating.dimension(), reason, DisputeStatus.PENDING, null, null,
                lockedCost, BigDecimal.ZERO, now, null);
    }

    public boolean isPending() {
        return status == DisputeStatus.PENDING;
    }

    public Dispute resolve(Verdict verdict, String arbitrator, String notes, BigDecimal slashed, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Dispute " + disputeId + " is already " + status);
        }
        return new Dispute(disputeId, ratingId, initiatorId, raterId, targetId, dimension, reason,
                verdict.status(), arbitrator, notes, lockedCost, slashed, createdAt, now);
    }
}
