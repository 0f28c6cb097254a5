package com.repledger.engine.reputation;

import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Scale;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the Beta-distribution arithmetic.
 */
class ReputationMathPropertyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static SystemConfig config(double decayRate, double priorAlpha, double priorBeta) {
        return new SystemConfig(new BigDecimal("1000"), new BigDecimal("100"), 0.3, decayRate, 86_400L,
                priorAlpha, priorBeta, 0.1, 5.0, Set.of("quality"), Map.of("quality", "rater_quality"), 1L, T0);
    }

    // ==================== Decay ====================

    /**
     * Property: decay never pulls alpha or beta below the prior, for any elapsed time.
     */
    @Property(tries = 300)
    void decayNeverCrossesThePrior(
            @ForAll @DoubleRange(min = 0.5, max = 3.0) double priorAlpha,
            @ForAll @DoubleRange(min = 0.5, max = 3.0) double priorBeta,
            @ForAll @DoubleRange(min = 0.0, max = 500.0) double extraAlpha,
            @ForAll @DoubleRange(min = 0.0, max = 500.0) double extraBeta,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double decayRate,
            @ForAll @LongRange(min = 0, max = 3_650L * 86_400L) long elapsedSeconds) {
        SystemConfig config = config(decayRate, priorAlpha, priorBeta);
        Reputation stored = new Reputation("bob", "quality", priorAlpha + extraAlpha, priorBeta + extraBeta, 7, T0);

        Reputation decayed = ReputationMath.applyDecay(stored, config, T0.plusSeconds(elapsedSeconds));

        assertThat(decayed.alpha()).isGreaterThanOrEqualTo(priorAlpha).isLessThanOrEqualTo(stored.alpha());
        assertThat(decayed.beta()).isGreaterThanOrEqualTo(priorBeta).isLessThanOrEqualTo(stored.beta());
        assertThat(decayed.totalEvents()).isEqualTo(stored.totalEvents());
        assertThat(decayed.lastUpdated()).isEqualTo(stored.lastUpdated());
    }

    /**
     * Property: the adaptive rate stays in [0,1] and never exceeds the configured base rate.
     */
    @Property(tries = 300)
    void adaptiveRateIsBoundedByBaseRate(
            @ForAll @DoubleRange(min = 0.01, max = 1000.0) double alpha,
            @ForAll @DoubleRange(min = 0.01, max = 1000.0) double beta,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double baseRate) {
        double rate = ReputationMath.adaptiveDecayRate(alpha, beta, baseRate);

        assertThat(rate).isBetween(0.0, 1.0).isLessThanOrEqualTo(baseRate);
    }

    @Test
    void uncertainRecordsDecayFaster() {
        double thin = ReputationMath.adaptiveDecayRate(1.0, 1.0, 0.98);
        double thick = ReputationMath.adaptiveDecayRate(400.0, 100.0, 0.98);

        assertThat(thin).isCloseTo(0.96, within(1e-12));
        assertThat(thick).isGreaterThan(thin).isLessThanOrEqualTo(0.98);
    }

    @Test
    void futureLastUpdatedIsTreatedAsNoElapsedTime() {
        SystemConfig config = config(0.5, 1.0, 1.0);
        Reputation stored = new Reputation("bob", "quality", 9.0, 3.0, 10, T0.plusSeconds(3_600));

        assertThat(ReputationMath.applyDecay(stored, config, T0)).isEqualTo(stored);
    }

    // ==================== Wilson interval ====================

    /**
     * Property: for all alpha, beta > 0, 0 <= lower <= score <= upper <= 1.
     */
    @Property(tries = 500)
    void wilsonIntervalBracketsTheScore(
            @ForAll @DoubleRange(min = 0.001, max = 10_000.0) @Scale(3) double alpha,
            @ForAll @DoubleRange(min = 0.001, max = 10_000.0) @Scale(3) double beta,
            @ForAll ConfidenceLevel level) {
        ConfidenceInterval interval = ReputationMath.wilsonInterval(alpha, beta, level);
        double score = ReputationMath.score(alpha, beta);

        assertThat(interval.lower()).isGreaterThanOrEqualTo(0.0);
        assertThat(interval.lower()).isLessThanOrEqualTo(score);
        assertThat(interval.upper()).isGreaterThanOrEqualTo(score);
        assertThat(interval.upper()).isLessThanOrEqualTo(1.0);
        assertThat(interval.contains(score)).isTrue();
    }

    @Property(tries = 200)
    void widerConfidenceGivesWiderInterval(
            @ForAll @DoubleRange(min = 1.0, max = 1000.0) double alpha,
            @ForAll @DoubleRange(min = 1.0, max = 1000.0) double beta) {
        ConfidenceInterval p95 = ReputationMath.wilsonInterval(alpha, beta, ConfidenceLevel.P95);
        ConfidenceInterval p99 = ReputationMath.wilsonInterval(alpha, beta, ConfidenceLevel.P99);

        assertThat(p99.width()).isGreaterThanOrEqualTo(p95.width() - 1e-12);
    }

    @Test
    void onlyNinetyFiveAndNinetyNineAreSupported() {
        assertThat(ConfidenceLevel.fromValue(0.95)).isEqualTo(ConfidenceLevel.P95);
        assertThat(ConfidenceLevel.fromValue(0.99)).isEqualTo(ConfidenceLevel.P99);
        assertThatThrownBy(() -> ConfidenceLevel.fromValue(0.9))
                .isInstanceOf(InvalidInputException.class)
                .extracting(e -> ((InvalidInputException) e).reason())
                .isEqualTo(InvalidInputException.Reason.INVALID_CONFIDENCE);
    }

    @Test
    void evidenceConfidenceGrowsWithEvents() {
        assertThat(ReputationMath.evidenceConfidence(0)).isZero();
        assertThat(ReputationMath.evidenceConfidence(1)).isEqualTo(0.5);
        assertThat(ReputationMath.evidenceConfidence(9)).isCloseTo(0.9, within(1e-12));
    }
}
