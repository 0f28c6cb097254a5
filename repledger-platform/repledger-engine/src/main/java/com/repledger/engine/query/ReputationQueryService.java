package com.repledger.engine.query;

import com.repledger.core.domain.Dispute;
import com.repledger.core.domain.DisputeStatus;
import com.repledger.core.domain.Rating;
import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.Stake;
import com.repledger.core.domain.SuspiciousRating;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.error.NotFoundException;
import com.repledger.core.identity.IdentityNormalizer;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.config.ConfigurationService;
import com.repledger.engine.reputation.ConfidenceInterval;
import com.repledger.engine.reputation.ConfidenceLevel;
import com.repledger.engine.reputation.ReputationMath;
import com.repledger.engine.reputation.ReputationService;
import com.repledger.engine.stake.StakeLedgerService;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only views over the ledger. Every method works inside a transaction that is never
 * committed, so reputations are reported with decay projected to the query time but nothing is
 * written back.
 */
@Service
public class ReputationQueryService {

    private final ConfigurationService configurationService;
    private final ReputationService reputationService;
    private final StakeLedgerService stakeLedger;

    public ReputationQueryService(ConfigurationService configurationService,
                                  ReputationService reputationService,
                                  StakeLedgerService stakeLedger) {
        this.configurationService = configurationService;
        this.reputationService = reputationService;
        this.stakeLedger = stakeLedger;
    }

    // ==================== Reputation ====================

    public ReputationView getReputation(LedgerTransaction tx, String actor, String dimension, double confidence) {
        ConfidenceLevel level = ConfidenceLevel.fromValue(confidence);
        SystemConfig config = configurationService.getConfig(tx);
        requireKnownDimension(config, dimension);
        return view(tx, config, requireActor(actor), dimension, level);
    }

    /**
     * Reputations of several actors in one dimension. Blank and duplicate entries are skipped.
     */
    public List<ReputationView> batchGetReputations(LedgerTransaction tx, Collection<String> actors, String dimension) {
        SystemConfig config = configurationService.getConfig(tx);
        requireKnownDimension(config, dimension);
        Set<String> actorIds = new LinkedHashSet<>();
        for (String actor : actors) {
            String actorId = IdentityNormalizer.normalize(actor);
            if (!actorId.isEmpty()) {
                actorIds.add(actorId);
            }
        }
        List<ReputationView> views = new ArrayList<>(actorIds.size());
        for (String actorId : actorIds) {
            views.add(view(tx, config, actorId, dimension, ConfidenceLevel.P95));
        }
        return views;
    }

    public List<ReputationView> batchGetReputations(LedgerTransaction tx, String commaSeparatedActors, String dimension) {
        String list = commaSeparatedActors == null ? "" : commaSeparatedActors;
        return batchGetReputations(tx, Arrays.asList(list.split(",")), dimension);
    }

    /**
     * Every actor that holds at least one reputation record, in key order.
     */
    public List<String> allActors(LedgerTransaction tx) {
        Set<String> actors = new TreeSet<>();
        for (Reputation reputation : tx.range(LedgerKeys.prefix(LedgerKeys.REPUTATION), Reputation.class)) {
            actors.add(reputation.actorId());
        }
        return new ArrayList<>(actors);
    }

    // ==================== Stake ====================

    public StakeView getStake(LedgerTransaction tx, String actor) {
        Stake stake = stakeLedger.getOrInit(tx, requireActor(actor));
        return new StakeView(stake.actorId(), stake.available(), stake.locked(), stake.total(), stake.lastUpdated());
    }

    // ==================== Ratings ====================

    public Rating getRating(LedgerTransaction tx, String ratingId) {
        return tx.get(LedgerKeys.rating(ratingId), Rating.class)
                .orElseThrow(() -> new NotFoundException("Rating", ratingId));
    }

    /**
     * Ratings received by {@code target}, optionally limited to one dimension, oldest first.
     */
    public List<Rating> ratingHistory(LedgerTransaction tx, String target, String dimension) {
        String targetId = requireActor(target);
        return allRatings(tx).stream()
                .filter(r -> r.targetId().equals(targetId))
                .filter(r -> dimension == null || dimension.isBlank() || r.dimension().equals(dimension))
                .sorted(Comparator.comparing(Rating::timestamp).thenComparing(Rating::ratingId))
                .toList();
    }

    public List<Rating> ratingsByRater(LedgerTransaction tx, String rater) {
        String raterId = requireActor(rater);
        return allRatings(tx).stream()
                .filter(r -> r.raterId().equals(raterId))
                .sorted(Comparator.comparing(Rating::timestamp).thenComparing(Rating::ratingId))
                .toList();
    }

    public List<SuspiciousRating> suspiciousRatings(LedgerTransaction tx) {
        return tx.range(LedgerKeys.prefix(LedgerKeys.SUSPICIOUS), SuspiciousRating.class);
    }

    // ==================== Disputes ====================

    public Dispute getDispute(LedgerTransaction tx, String disputeId) {
        return tx.get(LedgerKeys.dispute(disputeId), Dispute.class)
                .orElseThrow(() -> new NotFoundException("Dispute", disputeId));
    }

    public List<Dispute> disputesByStatus(LedgerTransaction tx, String status) {
        DisputeStatus wanted = parseStatus(status);
        return allDisputes(tx).stream()
                .filter(d -> d.status() == wanted)
                .toList();
    }

    public DisputeStats disputeStats(LedgerTransaction tx) {
        List<Dispute> disputes = allDisputes(tx);
        long pending = 0;
        long upheld = 0;
        long overturned = 0;
        long resolutionSeconds = 0;
        for (Dispute dispute : disputes) {
            switch (dispute.status()) {
                case PENDING -> pending++;
                case UPHELD -> upheld++;
                case OVERTURNED -> overturned++;
            }
            if (dispute.resolvedAt() != null && dispute.createdAt() != null) {
                resolutionSeconds += Duration.between(dispute.createdAt(), dispute.resolvedAt()).getSeconds();
            }
        }
        long resolved = upheld + overturned;
        double upheldRate = resolved == 0 ? 0.0 : (double) upheld / resolved;
        double overturnedRate = resolved == 0 ? 0.0 : (double) overturned / resolved;
        Duration averageResolution = resolved == 0 ? Duration.ZERO : Duration.ofSeconds(resolutionSeconds / resolved);
        return new DisputeStats(disputes.size(), pending, upheld, overturned, upheldRate, overturnedRate,
                averageResolution);
    }

    // ==================== Profiles ====================

    public AgentProfile agentProfile(LedgerTransaction tx, String actor) {
        String actorId = requireActor(actor);
        SystemConfig config = configurationService.getConfig(tx);

        Map<String, ReputationView> reputations = new LinkedHashMap<>();
        for (String dimension : config.validDimensions()) {
            reputations.put(dimension, view(tx, config, actorId, dimension, ConfidenceLevel.P95));
        }

        List<Rating> ratings = allRatings(tx);
        long given = ratings.stream().filter(r -> r.raterId().equals(actorId)).count();
        long received = ratings.stream().filter(r -> r.targetId().equals(actorId)).count();

        List<Dispute> disputes = allDisputes(tx);
        long initiated = disputes.stream().filter(d -> d.initiatorId().equals(actorId)).count();
        long against = disputes.stream().filter(d -> d.raterId().equals(actorId)).count();

        return new AgentProfile(actorId, reputations, getStake(tx, actorId), given, received, initiated, against);
    }

    // ==================== Helpers ====================

    private ReputationView view(LedgerTransaction tx, SystemConfig config, String actorId, String dimension,
                                ConfidenceLevel level) {
        Reputation reputation = reputationService.effective(tx, config, actorId, dimension);
        ConfidenceInterval interval = ReputationMath.wilsonInterval(reputation.alpha(), reputation.beta(), level);
        return new ReputationView(actorId, dimension, reputation.score(), reputation.alpha(), reputation.beta(),
                interval.lower(), interval.upper(), level.level(),
                ReputationMath.evidenceConfidence(reputation.totalEvents()),
                reputation.totalEvents(), reputation.lastUpdated());
    }

    private List<Rating> allRatings(LedgerTransaction tx) {
        return tx.range(LedgerKeys.prefix(LedgerKeys.RATING), Rating.class);
    }

    private List<Dispute> allDisputes(LedgerTransaction tx) {
        return tx.range(LedgerKeys.prefix(LedgerKeys.DISPUTE), Dispute.class);
    }

    private static String requireActor(String actor) {
        String actorId = IdentityNormalizer.normalize(actor);
        if (actorId.isEmpty()) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Actor id is required");
        }
        return actorId;
    }

    private static void requireKnownDimension(SystemConfig config, String dimension) {
        if (!config.isValidDimension(dimension) && !config.isMetaDimension(dimension)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, "Unknown dimension: " + dimension);
        }
    }

    private static DisputeStatus parseStatus(String status) {
        if (status == null) {
            throw new InvalidInputException(Reason.MISSING_ARGUMENT, "Dispute status is required");
        }
        try {
            return DisputeStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(Reason.INVALID_VERDICT, "Unknown dispute status: " + status);
        }
    }

    // ==================== Views ====================

    public record ReputationView(
            String actorId,
            String dimension,
            double score,
            double alpha,
            double beta,
            double lowerBound,
            double upperBound,
            double confidenceLevel,
            double evidenceConfidence,
            long totalEvents,
            Instant lastUpdated
    ) {}

    public record StakeView(
            String actorId,
            BigDecimal available,
            BigDecimal locked,
            BigDecimal total,
            Instant lastUpdated
    ) {}

    public record DisputeStats(
            long totalDisputes,
            long pending,
            long upheld,
            long overturned,
            double upheldRate,
            double overturnedRate,
            Duration averageResolutionTime
    ) {}

    public record AgentProfile(
            String actorId,
            Map<String, ReputationView> reputations,
            StakeView stake,
            long ratingsGiven,
            long ratingsReceived,
            long disputesInitiated,
            long disputesAgainst
    ) {}
}
