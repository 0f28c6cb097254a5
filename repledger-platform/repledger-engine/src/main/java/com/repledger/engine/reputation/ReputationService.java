package com.repledger.engine.reputation;

import com.repledger.core.domain.Rating;
import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.identity.AccessPolicy;
import com.repledger.engine.ledger.NotificationTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reputation store keyed by (actor, dimension).
 *
 * <p>Reads return the stored record or the prior; decay is applied as a projection at read time
 * and only becomes part of the stored record when an update is written.
 */
@Service
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    private final AccessPolicy accessPolicy;

    public ReputationService(AccessPolicy accessPolicy) {
        this.accessPolicy = accessPolicy;
    }

    // ==================== Reads ====================

    public Optional<Reputation> findStored(LedgerTransaction tx, String actorId, String dimension) {
        return tx.get(LedgerKeys.reputation(actorId, dimension), Reputation.class);
    }

    /**
     * Stored record, or the prior when the actor has none yet. The prior is not written.
     */
    public Reputation getOrInit(LedgerTransaction tx, SystemConfig config, String actorId, String dimension) {
        return findStored(tx, actorId, dimension)
                .orElseGet(() -> Reputation.prior(actorId, dimension, config, tx.timestamp()));
    }

    /**
     * Record as it stands at the transaction timestamp, decay included.
     */
    public Reputation effective(LedgerTransaction tx, SystemConfig config, String actorId, String dimension) {
        return ReputationMath.applyDecay(getOrInit(tx, config, actorId, dimension), config, tx.timestamp());
    }

    // ==================== Writes ====================

    /**
     * Folds one weighted observation into the record: decay to now, then add {@code weight * value}
     * to alpha for positive observations or {@code weight * (1 - value)} to beta otherwise.
     */
    public Reputation update(LedgerTransaction tx, SystemConfig config, String actorId, String dimension,
                             double value, double weight) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidInputException(Reason.INVALID_VALUE, "Value must be within [0,1]: " + value);
        }
        if (!Double.isFinite(weight) || weight < 0) {
            throw new InvalidInputException(Reason.INVALID_VALUE, "Weight must be finite and >= 0: " + weight);
        }
        Reputation decayed = effective(tx, config, actorId, dimension);
        double alpha = decayed.alpha();
        double beta = decayed.beta();
        if (value >= 0.5) {
            alpha += weight * value;
        } else {
            beta += weight * (1.0 - value);
        }
        Reputation updated = decayed.recordEvent(alpha, beta, tx.timestamp());
        tx.put(LedgerKeys.reputation(actorId, dimension), updated);
        log.debug("Reputation {}/{} updated: value={} weight={} score={}",
                actorId, dimension, value, weight, updated.score());
        return updated;
    }

    /**
     * Removes the contribution of {@code rating} from its target's stored record. The prior is the
     * floor and the timestamp is left as it was.
     */
    public Reputation reverse(LedgerTransaction tx, SystemConfig config, Rating rating) {
        Reputation stored = getOrInit(tx, config, rating.targetId(), rating.dimension());
        double alpha = stored.alpha();
        double beta = stored.beta();
        if (rating.isPositive()) {
            alpha = Math.max(config.initialAlpha(), alpha - rating.contribution());
        } else {
            beta = Math.max(config.initialBeta(), beta - rating.contribution());
        }
        Reputation reverted = stored.revertEvent(alpha, beta);
        tx.put(LedgerKeys.reputation(rating.targetId(), rating.dimension()), reverted);
        log.debug("Reversed rating {} on {}/{}: score {} -> {}",
                rating.ratingId(), rating.targetId(), rating.dimension(), stored.score(), reverted.score());
        return reverted;
    }

    /**
     * Admin-only: restores the prior for one (actor, dimension) pair.
     */
    public Reputation reset(LedgerTransaction tx, SystemConfig config, String actorId, String dimension) {
        accessPolicy.requireAdmin(tx.callerId(), "reset a reputation");
        if (actorId == null || actorId.isEmpty()) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Actor id is required");
        }
        if (!config.isValidDimension(dimension) && !config.isMetaDimension(dimension)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, "Unknown dimension: " + dimension);
        }
        Reputation previous = getOrInit(tx, config, actorId, dimension);
        Reputation prior = Reputation.prior(actorId, dimension, config, tx.timestamp());
        tx.put(LedgerKeys.reputation(actorId, dimension), prior);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actorId", actorId);
        payload.put("dimension", dimension);
        payload.put("previousScore", previous.score());
        payload.put("resetBy", tx.callerId());
        tx.emit(NotificationTopics.REPUTATION_RESET, payload);

        log.info("Reputation {}/{} reset to prior by {}", actorId, dimension, tx.callerId());
        return prior;
    }
}
