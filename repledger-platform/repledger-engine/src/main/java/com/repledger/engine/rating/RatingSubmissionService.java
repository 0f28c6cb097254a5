package com.repledger.engine.rating;

import com.repledger.core.domain.Rating;
import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.error.SelfRatingForbiddenException;
import com.repledger.core.identity.IdentityNormalizer;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.core.ledger.RecordIds;
import com.repledger.engine.config.ConfigurationService;
import com.repledger.engine.config.ReputationEngineProperties;
import com.repledger.engine.ledger.NotificationTopics;
import com.repledger.engine.reputation.ReputationMath;
import com.repledger.engine.reputation.ReputationService;
import com.repledger.engine.stake.StakeLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rating submission pipeline.
 *
 * <p>Validates the rating, derives its deterministic id, checks the rater's stake, weighs the rater
 * by meta-reputation, stores the rating and folds it into the target's reputation. Replaying an
 * identical submission returns the same id without touching state.
 */
@Service
public class RatingSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(RatingSubmissionService.class);

    private final ConfigurationService configurationService;
    private final StakeLedgerService stakeLedger;
    private final ReputationService reputationService;
    private final RaterWeightCalculator weightCalculator;
    private final SuspiciousRatingDetector suspiciousRatingDetector;
    private final Duration maxClockSkew;

    public RatingSubmissionService(ConfigurationService configurationService,
                                   StakeLedgerService stakeLedger,
                                   ReputationService reputationService,
                                   RaterWeightCalculator weightCalculator,
                                   SuspiciousRatingDetector suspiciousRatingDetector,
                                   ReputationEngineProperties properties) {
        this.configurationService = configurationService;
        this.stakeLedger = stakeLedger;
        this.reputationService = reputationService;
        this.weightCalculator = weightCalculator;
        this.suspiciousRatingDetector = suspiciousRatingDetector;
        this.maxClockSkew = properties.getRating().getMaxClockSkew();
    }

    // ==================== Submission ====================

    public String submitRating(LedgerTransaction tx, RatingRequest request) {
        validateValue(request.value());
        validateTimestamp(tx, request.epochSeconds());
        SystemConfig config = configurationService.getConfig(tx);
        validateDimension(config, request.dimension());

        String raterId = tx.callerId();
        String targetId = IdentityNormalizer.normalize(request.targetId());
        if (targetId.isEmpty()) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Target actor is required");
        }
        if (raterId.equals(targetId)) {
            throw new SelfRatingForbiddenException(raterId);
        }

        String ratingId = RecordIds.ratingId(raterId, targetId, request.dimension(), request.epochSeconds());
        Rating candidate = new Rating(ratingId, raterId, targetId, request.dimension(), request.value(), 0.0,
                request.evidenceRef(), Instant.ofEpochSecond(request.epochSeconds()), tx.txId());

        Optional<Rating> existing = tx.get(LedgerKeys.rating(ratingId), Rating.class);
        if (existing.isPresent()) {
            if (existing.get().sameContentAs(candidate)) {
                log.debug("Rating {} replayed by {}; returning existing record", ratingId, raterId);
                return ratingId;
            }
            throw new InvalidInputException(Reason.RATING_ID_COLLISION,
                    "Rating " + ratingId + " already exists with different content");
        }

        stakeLedger.requireAvailable(tx, raterId, config.minStake());
        double weight = weightCalculator.weight(tx, config, raterId, request.dimension());
        Rating rating = new Rating(ratingId, raterId, targetId, request.dimension(), request.value(), weight,
                request.evidenceRef(), candidate.timestamp(), tx.txId());

        suspiciousRatingDetector.inspect(tx, config, rating);
        tx.put(LedgerKeys.rating(ratingId), rating);
        Reputation updated = reputationService.update(tx, config, targetId, request.dimension(),
                request.value(), weight);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ratingId", ratingId);
        payload.put("raterId", raterId);
        payload.put("targetId", targetId);
        payload.put("dimension", request.dimension());
        payload.put("value", request.value());
        payload.put("weight", weight);
        payload.put("newScore", updated.score());
        payload.put("totalEvents", updated.totalEvents());
        tx.emit(NotificationTopics.RATING_SUBMITTED, payload);

        log.debug("Rating {} recorded: {} -> {} [{}] value={} weight={}",
                ratingId, raterId, targetId, request.dimension(), request.value(), weight);
        return ratingId;
    }

    // ==================== Simulation ====================

    /**
     * Predicts what a rating from the caller would do to the target's score. Nothing is written.
     */
    public RatingImpact simulateRatingImpact(LedgerTransaction tx, String target, String dimension, double value) {
        validateValue(value);
        SystemConfig config = configurationService.getConfig(tx);
        validateDimension(config, dimension);
        String targetId = IdentityNormalizer.normalize(target);
        if (targetId.isEmpty()) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Target actor is required");
        }

        double weight = weightCalculator.weight(tx, config, tx.callerId(), dimension);
        Reputation current = reputationService.effective(tx, config, targetId, dimension);
        double alpha = current.alpha();
        double beta = current.beta();
        if (value >= 0.5) {
            alpha += weight * value;
        } else {
            beta += weight * (1.0 - value);
        }
        double currentScore = current.score();
        double projectedScore = ReputationMath.score(alpha, beta);
        return new RatingImpact(targetId, dimension, value, weight, currentScore, projectedScore,
                projectedScore - currentScore);
    }

    // ==================== Validation ====================

    private static void validateValue(double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidInputException(Reason.INVALID_VALUE, "Rating value must be within [0,1]: " + value);
        }
    }

    private void validateTimestamp(LedgerTransaction tx, long epochSeconds) {
        if (epochSeconds <= 0) {
            throw new InvalidInputException(Reason.INVALID_TIMESTAMP, "Timestamp must be positive: " + epochSeconds);
        }
        Instant latest = tx.timestamp().plus(maxClockSkew);
        if (epochSeconds > latest.getEpochSecond()) {
            throw new InvalidInputException(Reason.INVALID_TIMESTAMP,
                    "Timestamp " + epochSeconds + " is beyond the allowed clock skew of " + maxClockSkew);
        }
    }

    private static void validateDimension(SystemConfig config, String dimension) {
        if (!config.isValidDimension(dimension)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION,
                    "Invalid dimension '" + dimension + "'; valid: " + config.validDimensions());
        }
    }

    public record RatingRequest(
            String targetId,
            String dimension,
            double value,
            String evidenceRef,
            long epochSeconds
    ) {}

    public record RatingImpact(
            String targetId,
            String dimension,
            double value,
            double raterWeight,
            double currentScore,
            double projectedScore,
            double scoreDelta
    ) {}
}
