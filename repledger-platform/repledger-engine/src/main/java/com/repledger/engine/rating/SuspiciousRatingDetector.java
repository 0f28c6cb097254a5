package com.repledger.engine.rating;

import com.repledger.core.domain.Rating;
import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.SuspiciousRating;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.ledger.NotificationTopics;
import com.repledger.engine.reputation.ReputationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flags extreme ratings from raters with little track record. Flags are advisory: they are stored
 * and announced but never block the rating.
 */
@Component
public class SuspiciousRatingDetector {

    private static final Logger log = LoggerFactory.getLogger(SuspiciousRatingDetector.class);

    static final long NEW_RATER_EVENT_THRESHOLD = 5;
    static final double LOW_EXTREME = 0.1;
    static final double HIGH_EXTREME = 0.9;
    static final double SYBIL_CONFIDENCE = 0.6;

    private final ReputationService reputationService;

    public SuspiciousRatingDetector(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    public Optional<SuspiciousRating> inspect(LedgerTransaction tx, SystemConfig config, Rating rating) {
        String metaDimension = RaterWeightCalculator.metaDimension(config, rating.dimension());
        long raterEvents = reputationService.findStored(tx, rating.raterId(), metaDimension)
                .map(Reputation::totalEvents)
                .orElse(0L);
        boolean extreme = rating.value() < LOW_EXTREME || rating.value() > HIGH_EXTREME;
        if (raterEvents >= NEW_RATER_EVENT_THRESHOLD || !extreme) {
            return Optional.empty();
        }

        SuspiciousRating flag = new SuspiciousRating(
                rating.ratingId(),
                SuspiciousRating.Type.POTENTIAL_SYBIL,
                rating.raterId(),
                rating.targetId(),
                rating.dimension(),
                rating.value(),
                SYBIL_CONFIDENCE,
                "New rater (" + raterEvents + " events) gave extreme rating " + rating.value(),
                tx.timestamp());
        tx.put(LedgerKeys.suspicious(rating.ratingId()), flag);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ratingId", flag.ratingId());
        payload.put("type", flag.type().name());
        payload.put("raterId", flag.raterId());
        payload.put("targetId", flag.targetId());
        payload.put("confidence", flag.confidence());
        tx.emit(NotificationTopics.RATING_SUSPICIOUS, payload);

        log.warn("Suspicious rating {}: {}", flag.ratingId(), flag.description());
        return Optional.of(flag);
    }
}
