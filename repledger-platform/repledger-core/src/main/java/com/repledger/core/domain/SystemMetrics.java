package com.repledger.core.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Running telemetry counters. Not authoritative: can always be rebuilt from ratings and disputes.
 */
public record SystemMetrics(
        long totalRatings,
        long totalDisputes,
        long disputesUpheld,
        long disputesOverturned,
        BigDecimal totalStakeSlashed,
        Instant lastUpdated
) {

    public static SystemMetrics empty(Instant now) {
        return new SystemMetrics(0, 0, 0, 0, BigDecimal.ZERO, now);
    }

    public SystemMetrics ratingSubmitted(Instant now) {
        return new SystemMetrics(totalRatings + 1, totalDisputes, disputesUpheld, disputesOverturned,
                totalStakeSlashed, now);
    }

    public SystemMetrics disputeInitiated(Instant now) {
        return new SystemMetrics(totalRatings, totalDisputes + 1, disputesUpheld, disputesOverturned,
                totalStakeSlashed, now);
    }

    public SystemMetrics disputeResolved(Verdict verdict, BigDecimal slashed, Instant now) {
        return new SystemMetrics(totalRatings, totalDisputes,
                disputesUpheld + (verdict == Verdict.UPHELD ? 1 : 0),
                disputesOverturned + (verdict == Verdict.OVERTURNED ? 1 : 0),
                totalStakeSlashed.add(slashed), now);
    }
}
