package com.repledger.engine.rating;

import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.reputation.ReputationMath;
import com.repledger.engine.reputation.ReputationService;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Weight of a rater's opinion in one base dimension, derived from the rater's meta-reputation in
 * the paired meta dimension.
 *
 * <p>weight = metaScore * (1 + sqrt(n / (n + 10))), n = alpha + beta of the decayed meta record,
 * clamped to [minRaterWeight, maxRaterWeight]. Raters with no meta record start at the minimum.
 * The meta record is read by key, so the recursion is one lookup deep.
 */
@Component
public class RaterWeightCalculator {

    static final double EVIDENCE_SATURATION = 10.0;

    private final ReputationService reputationService;

    public RaterWeightCalculator(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    public double weight(LedgerTransaction tx, SystemConfig config, String raterId, String baseDimension) {
        String metaDimension = metaDimension(config, baseDimension);
        Optional<Reputation> stored = reputationService.findStored(tx, raterId, metaDimension);
        if (stored.isEmpty()) {
            return config.minRaterWeight();
        }
        Reputation meta = ReputationMath.applyDecay(stored.get(), config, tx.timestamp());
        return weightFor(meta.alpha(), meta.beta(), config);
    }

    public static double weightFor(double alpha, double beta, SystemConfig config) {
        double n = alpha + beta;
        double metaScore = ReputationMath.score(alpha, beta);
        double multiplier = 1.0 + Math.sqrt(n / (n + EVIDENCE_SATURATION));
        double raw = metaScore * multiplier;
        return Math.max(config.minRaterWeight(), Math.min(config.maxRaterWeight(), raw));
    }

    public static String metaDimension(SystemConfig config, String baseDimension) {
        return config.metaDimensionFor(baseDimension)
                .orElseThrow(() -> new InvalidInputException(Reason.NO_META_DIMENSION,
                        "No meta dimension mapped for " + baseDimension));
    }
}
