package com.repledger.engine.rating;

import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.support.LedgerFixture;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for meta-reputation based rater weights.
 */
class RaterWeightCalculatorPropertyTest {

    private static final SystemConfig CONFIG = new SystemConfig(new BigDecimal("1000"), new BigDecimal("100"),
            0.3, 0.98, 86_400L, 1.0, 1.0, 0.1, 5.0,
            Set.of("quality"), Map.of("quality", "rater_quality"), 1L, Instant.EPOCH);

    /**
     * Property: the weight always lies within [minRaterWeight, maxRaterWeight].
     */
    @Property(tries = 500)
    void weightStaysWithinConfiguredBounds(
            @ForAll @DoubleRange(min = 1.0, max = 100_000.0) double alpha,
            @ForAll @DoubleRange(min = 1.0, max = 100_000.0) double beta) {
        double weight = RaterWeightCalculator.weightFor(alpha, beta, CONFIG);

        assertThat(weight).isBetween(CONFIG.minRaterWeight(), CONFIG.maxRaterWeight());
    }

    /**
     * Property: with the same track record ratio, more evidence never lowers the weight.
     */
    @Property(tries = 200)
    void moreEvidenceNeverLowersWeight(
            @ForAll @DoubleRange(min = 0.05, max = 0.95) double accuracy,
            @ForAll @DoubleRange(min = 2.0, max = 1000.0) double evidence) {
        double thin = RaterWeightCalculator.weightFor(accuracy * evidence, (1 - accuracy) * evidence, CONFIG);
        double thick = RaterWeightCalculator.weightFor(accuracy * evidence * 2, (1 - accuracy) * evidence * 2, CONFIG);

        assertThat(thick).isGreaterThanOrEqualTo(thin - 1e-12);
    }

    @Test
    void raterWithoutTrackRecordGetsMinimumWeight() {
        LedgerFixture fixture = new LedgerFixture();
        LedgerTransaction tx = fixture.tx("alice");
        SystemConfig config = fixture.configuration.getConfig(tx);

        assertThat(fixture.weights.weight(tx, config, "alice", "quality")).isEqualTo(0.1);
    }

    @Test
    void unmappedDimensionHasNoMetaDimension() {
        assertThatThrownBy(() -> RaterWeightCalculator.metaDimension(CONFIG, "delivery"))
                .isInstanceOf(InvalidInputException.class)
                .extracting(e -> ((InvalidInputException) e).reason())
                .isEqualTo(InvalidInputException.Reason.NO_META_DIMENSION);
    }

    @Test
    void balancedPriorRecordWeighsAboutHalf() {
        double weight = RaterWeightCalculator.weightFor(1.0, 1.0, CONFIG);

        assertThat(weight).isCloseTo(0.5 * (1 + Math.sqrt(2.0 / 12.0)), within(1e-12));
    }
}
