package com.repledger.engine.dispute;

import com.repledger.core.domain.Dispute;
import com.repledger.core.domain.Rating;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.domain.Verdict;
import com.repledger.core.error.AlreadyResolvedException;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.error.NotFoundException;
import com.repledger.core.error.UnauthorizedException;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.core.ledger.RecordIds;
import com.repledger.engine.config.ConfigurationService;
import com.repledger.engine.identity.AccessPolicy;
import com.repledger.engine.ledger.NotificationTopics;
import com.repledger.engine.rating.RaterWeightCalculator;
import com.repledger.engine.reputation.ReputationService;
import com.repledger.engine.stake.StakeLedgerService;
import com.repledger.engine.stake.StakeLedgerService.SlashResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Dispute state machine: PENDING to UPHELD or OVERTURNED, once.
 *
 * <p>Initiation locks the dispute cost from the rating's target. Resolution always feeds the
 * verdict into the original rater's meta-reputation and refunds the initiator; an overturned
 * verdict additionally reverses the rating and slashes the rater. All of it is written in the
 * caller's single transaction, so either every effect lands or none does.
 */
@Service
public class DisputeService {

    private static final Logger log = LoggerFactory.getLogger(DisputeService.class);

    private static final double META_EVIDENCE_WEIGHT = 1.0;

    private final ConfigurationService configurationService;
    private final StakeLedgerService stakeLedger;
    private final ReputationService reputationService;
    private final AccessPolicy accessPolicy;

    public DisputeService(ConfigurationService configurationService,
                          StakeLedgerService stakeLedger,
                          ReputationService reputationService,
                          AccessPolicy accessPolicy) {
        this.configurationService = configurationService;
        this.stakeLedger = stakeLedger;
        this.reputationService = reputationService;
        this.accessPolicy = accessPolicy;
    }

    // ==================== Initiation ====================

    /**
     * Opens a dispute against a rating. Only the rated actor may do so; retrying returns the
     * pending dispute's id.
     */
    public String initiateDispute(LedgerTransaction tx, String ratingId, String reason) {
        if (ratingId == null || ratingId.isBlank()) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Rating id is required");
        }
        Rating rating = tx.get(LedgerKeys.rating(ratingId), Rating.class)
                .orElseThrow(() -> new NotFoundException("Rating", ratingId));

        String initiatorId = tx.callerId();
        if (!initiatorId.equals(rating.targetId())) {
            throw new UnauthorizedException("Only the rated actor may dispute rating " + ratingId
                    + "; caller: " + initiatorId);
        }

        String disputeId = RecordIds.disputeId(ratingId, initiatorId);
        Optional<Dispute> existing = tx.get(LedgerKeys.dispute(disputeId), Dispute.class);
        if (existing.isPresent()) {
            if (existing.get().isPending()) {
                log.debug("Dispute {} already pending; returning existing id", disputeId);
                return disputeId;
            }
            throw new AlreadyResolvedException(disputeId);
        }

        SystemConfig config = configurationService.getConfig(tx);
        BigDecimal cost = config.disputeCost();
        stakeLedger.lockForDispute(tx, initiatorId, cost);

        Dispute dispute = Dispute.open(disputeId, rating, initiatorId, reason, cost, tx.timestamp());
        tx.put(LedgerKeys.dispute(disputeId), dispute);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("disputeId", disputeId);
        payload.put("ratingId", ratingId);
        payload.put("initiatorId", initiatorId);
        payload.put("raterId", rating.raterId());
        payload.put("lockedCost", cost.toPlainString());
        tx.emit(NotificationTopics.DISPUTE_INITIATED, payload);

        log.info("Dispute {} opened by {} against rating {} (cost {} locked)", disputeId, initiatorId, ratingId, cost);
        return disputeId;
    }

    // ==================== Resolution ====================

    public Dispute resolveDispute(LedgerTransaction tx, String disputeId, String verdictText, String notes) {
        Verdict verdict = Verdict.parse(verdictText)
                .orElseThrow(() -> new InvalidInputException(Reason.INVALID_VERDICT,
                        "Verdict must be 'upheld' or 'overturned': " + verdictText));
        String arbitratorId = tx.callerId();
        accessPolicy.requireArbitrator(arbitratorId);

        Dispute dispute = tx.get(LedgerKeys.dispute(disputeId), Dispute.class)
                .orElseThrow(() -> new NotFoundException("Dispute", disputeId));
        if (!dispute.isPending()) {
            throw new AlreadyResolvedException(disputeId);
        }
        Rating rating = tx.get(LedgerKeys.rating(dispute.ratingId()), Rating.class)
                .orElseThrow(() -> new NotFoundException("Rating", dispute.ratingId()));
        SystemConfig config = configurationService.getConfig(tx);

        // the rater's track record learns from every verdict
        String metaDimension = RaterWeightCalculator.metaDimension(config, rating.dimension());
        double metaValue = verdict == Verdict.UPHELD ? 1.0 : 0.0;
        reputationService.update(tx, config, rating.raterId(), metaDimension, metaValue, META_EVIDENCE_WEIGHT);

        BigDecimal slashed = BigDecimal.ZERO;
        if (verdict == Verdict.OVERTURNED) {
            reputationService.reverse(tx, config, rating);
            SlashResult slash = stakeLedger.slash(tx, rating.raterId(), config.slashFraction());
            slashed = slash.slashed();
        }

        stakeLedger.releaseLock(tx, dispute.initiatorId(), dispute.lockedCost());

        Dispute resolved = dispute.resolve(verdict, arbitratorId, notes, slashed, tx.timestamp());
        tx.put(LedgerKeys.dispute(disputeId), resolved);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("disputeId", disputeId);
        payload.put("ratingId", rating.ratingId());
        payload.put("verdict", verdict.name().toLowerCase(Locale.ROOT));
        payload.put("arbitratorId", arbitratorId);
        payload.put("raterId", rating.raterId());
        payload.put("slashed", slashed.toPlainString());
        tx.emit(NotificationTopics.DISPUTE_RESOLVED, payload);

        log.info("Dispute {} resolved {} by {}; slashed {} from {}",
                disputeId, verdict, arbitratorId, slashed.toPlainString(), rating.raterId());
        return resolved;
    }
}
