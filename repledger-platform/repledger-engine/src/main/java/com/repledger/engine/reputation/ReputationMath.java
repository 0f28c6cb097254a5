package com.repledger.engine.reputation;

import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SystemConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure Beta-distribution arithmetic: variance, adaptive decay and the Wilson score interval.
 * Nothing here touches state.
 */
public final class ReputationMath {

    /** Variance of Beta(1,1), the largest a prior-or-better record can have. */
    static final double MAX_VARIANCE = 1.0 / 12.0;

    private ReputationMath() {
    }

    public static double score(double alpha, double beta) {
        double n = alpha + beta;
        return n <= 0 ? 0.0 : alpha / n;
    }

    public static double variance(double alpha, double beta) {
        double n = alpha + beta;
        if (n <= 0) {
            return 0.0;
        }
        return (alpha * beta) / (n * n * (n + 1.0));
    }

    /**
     * Decay rate per period, lowered for uncertain records so that thin evidence fades faster.
     */
    public static double adaptiveDecayRate(double alpha, double beta, double baseRate) {
        double normalizedVariance = clamp(variance(alpha, beta) / MAX_VARIANCE, 0.0, 1.0);
        return clamp(baseRate - (1.0 - baseRate) * normalizedVariance, 0.0, 1.0);
    }

    /**
     * Projects {@code reputation} forward to {@code now}. Alpha and beta never fall below the prior
     * and the stored record is left untouched.
     */
    public static Reputation applyDecay(Reputation reputation, SystemConfig config, Instant now) {
        if (reputation.lastUpdated() == null || now == null) {
            return reputation;
        }
        double elapsedSeconds = Math.max(0L, Duration.between(reputation.lastUpdated(), now).getSeconds());
        if (elapsedSeconds == 0) {
            return reputation;
        }
        double rate = adaptiveDecayRate(reputation.alpha(), reputation.beta(), config.decayRate());
        double factor = Math.pow(rate, elapsedSeconds / config.decayPeriodSeconds());
        double alpha = Math.max(config.initialAlpha(), reputation.alpha() * factor);
        double beta = Math.max(config.initialBeta(), reputation.beta() * factor);
        return reputation.withParameters(alpha, beta);
    }

    /**
     * Wilson score interval on n = alpha + beta trials with success proportion alpha / n. The result
     * is clamped to [0,1] and always contains the point score.
     */
    public static ConfidenceInterval wilsonInterval(double alpha, double beta, ConfidenceLevel level) {
        double n = alpha + beta;
        if (n <= 0) {
            return new ConfidenceInterval(0.0, 1.0, level);
        }
        double p = alpha / n;
        double z = level.z();
        double z2 = z * z;
        double denominator = 1.0 + z2 / n;
        double center = p + z2 / (2.0 * n);
        double margin = z * Math.sqrt((p * (1.0 - p) + z2 / (4.0 * n)) / n);

        double lower = clamp((center - margin) / denominator, 0.0, 1.0);
        double upper = clamp((center + margin) / denominator, 0.0, 1.0);
        return new ConfidenceInterval(Math.min(lower, p), Math.max(upper, p), level);
    }

    /**
     * Confidence in the amount of evidence, independent of its direction.
     */
    public static double evidenceConfidence(long totalEvents) {
        return 1.0 - 1.0 / (1.0 + Math.max(0L, totalEvents));
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
