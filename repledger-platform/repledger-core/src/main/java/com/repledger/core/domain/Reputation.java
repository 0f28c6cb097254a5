package com.repledger.core.domain;

import java.time.Instant;

/**
 * Beta-distribution state for one (actor, dimension) pair.
 * Alpha accumulates weighted positive evidence, beta weighted negative evidence.
 */
public record Reputation(
        String actorId,
        String dimension,
        double alpha,
        double beta,
        long totalEvents,
        Instant lastUpdated
) {

    public static Reputation prior(String actorId, String dimension, SystemConfig config, Instant now) {
        return new Reputation(actorId, dimension, config.initialAlpha(), config.initialBeta(), 0L, now);
    }

    /**
     * Point estimate: the mean of the Beta distribution.
     */
    public double score() {
        double denominator = alpha + beta;
        if (denominator <= 0) {
            return 0.0;
        }
        return alpha / denominator;
    }

    public Reputation withParameters(double newAlpha, double newBeta) {
        return new Reputation(actorId, dimension, newAlpha, newBeta, totalEvents, lastUpdated);
    }

    public Reputation recordEvent(double newAlpha, double newBeta, Instant now) {
        return new Reputation(actorId, dimension, newAlpha, newBeta, totalEvents + 1, now);
    }

    public Reputation revertEvent(double newAlpha, double newBeta) {
        return new Reputation(actorId, dimension, newAlpha, newBeta, Math.max(0L, totalEvents - 1), lastUpdated);
    }
}
