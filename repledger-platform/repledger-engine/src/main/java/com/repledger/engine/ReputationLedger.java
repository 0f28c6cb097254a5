package com.repledger.engine;

import com.repledger.core.domain.Dispute;
import com.repledger.core.domain.Rating;
import com.repledger.core.domain.Reputation;
import com.repledger.core.domain.Stake;
import com.repledger.core.domain.SuspiciousRating;
import com.repledger.core.domain.SystemConfig;
import com.repledger.core.domain.SystemMetrics;
import com.repledger.core.identity.IdentityNormalizer;
import com.repledger.engine.config.ConfigurationService;
import com.repledger.engine.dispute.DisputeService;
import com.repledger.engine.ledger.LedgerTransactionExecutor;
import com.repledger.engine.metrics.SystemMetricsService;
import com.repledger.engine.query.ReputationQueryService;
import com.repledger.engine.query.ReputationQueryService.AgentProfile;
import com.repledger.engine.query.ReputationQueryService.DisputeStats;
import com.repledger.engine.query.ReputationQueryService.ReputationView;
import com.repledger.engine.query.ReputationQueryService.StakeView;
import com.repledger.engine.rating.RatingSubmissionService;
import com.repledger.engine.rating.RatingSubmissionService.RatingImpact;
import com.repledger.engine.rating.RatingSubmissionService.RatingRequest;
import com.repledger.engine.reputation.ReputationService;
import com.repledger.engine.stake.StakeLedgerService;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Callable surface of the reputation ledger.
 *
 * <p>Every method takes the caller's raw credential first and runs as one ledger transaction:
 * mutations commit atomically or fail with a {@link com.repledger.core.error.LedgerException},
 * queries never write.
 */
@Service
public class ReputationLedger {

    private final LedgerTransactionExecutor executor;
    private final ConfigurationService configurationService;
    private final StakeLedgerService stakeLedger;
    private final ReputationService reputationService;
    private final RatingSubmissionService ratingSubmission;
    private final DisputeService disputeService;
    private final ReputationQueryService queries;
    private final SystemMetricsService metrics;

    public ReputationLedger(LedgerTransactionExecutor executor,
                            ConfigurationService configurationService,
                            StakeLedgerService stakeLedger,
                            ReputationService reputationService,
                            RatingSubmissionService ratingSubmission,
                            DisputeService disputeService,
                            ReputationQueryService queries,
                            SystemMetricsService metrics) {
        this.executor = executor;
        this.configurationService = configurationService;
        this.stakeLedger = stakeLedger;
        this.reputationService = reputationService;
        this.ratingSubmission = ratingSubmission;
        this.disputeService = disputeService;
        this.queries = queries;
        this.metrics = metrics;
    }

    // ==================== Configuration ====================

    public SystemConfig initConfig(String caller) {
        return executor.execute(caller, "initConfig", configurationService::initConfig);
    }

    public SystemConfig getConfig(String caller) {
        return executor.query(caller, configurationService::getConfig);
    }

    public SystemConfig updateConfig(String caller, SystemConfig proposed) {
        return executor.execute(caller, "updateConfig", tx -> configurationService.updateConfig(tx, proposed));
    }

    public SystemConfig addDimension(String caller, String dimension, String metaDimension) {
        return executor.execute(caller, "addDimension",
                tx -> configurationService.addDimension(tx, dimension, metaDimension));
    }

    // ==================== Stake ====================

    public Stake depositStake(String caller, double amount) {
        return executor.execute(caller, "depositStake", tx -> stakeLedger.deposit(tx, tx.callerId(), amount));
    }

    public StakeView getStake(String caller, String actor) {
        return executor.query(caller, tx -> queries.getStake(tx, actor));
    }

    // ==================== Ratings ====================

    public String submitRating(String caller, String target, String dimension, double value,
                               String evidenceRef, long epochSeconds) {
        RatingRequest request = new RatingRequest(target, dimension, value, evidenceRef, epochSeconds);
        return executor.execute(caller, "submitRating", tx -> ratingSubmission.submitRating(tx, request));
    }

    public RatingImpact simulateRatingImpact(String caller, String target, String dimension, double value) {
        return executor.query(caller, tx -> ratingSubmission.simulateRatingImpact(tx, target, dimension, value));
    }

    public Rating getRating(String caller, String ratingId) {
        return executor.query(caller, tx -> queries.getRating(tx, ratingId));
    }

    public List<Rating> getRatingHistory(String caller, String target, String dimension) {
        return executor.query(caller, tx -> queries.ratingHistory(tx, target, dimension));
    }

    public List<Rating> getRatingsByRater(String caller, String rater) {
        return executor.query(caller, tx -> queries.ratingsByRater(tx, rater));
    }

    public List<SuspiciousRating> getSuspiciousRatings(String caller) {
        return executor.query(caller, queries::suspiciousRatings);
    }

    // ==================== Disputes ====================

    public String initiateDispute(String caller, String ratingId, String reason) {
        return executor.execute(caller, "initiateDispute", tx -> disputeService.initiateDispute(tx, ratingId, reason));
    }

    public Dispute resolveDispute(String caller, String disputeId, String verdict, String notes) {
        return executor.execute(caller, "resolveDispute",
                tx -> disputeService.resolveDispute(tx, disputeId, verdict, notes));
    }

    public Dispute getDispute(String caller, String disputeId) {
        return executor.query(caller, tx -> queries.getDispute(tx, disputeId));
    }

    public List<Dispute> getDisputesByStatus(String caller, String status) {
        return executor.query(caller, tx -> queries.disputesByStatus(tx, status));
    }

    public DisputeStats getDisputeStats(String caller) {
        return executor.query(caller, queries::disputeStats);
    }

    // ==================== Reputation ====================

    public ReputationView getReputation(String caller, String actor, String dimension, double confidence) {
        return executor.query(caller, tx -> queries.getReputation(tx, actor, dimension, confidence));
    }

    public List<ReputationView> batchGetReputations(String caller, Collection<String> actors, String dimension) {
        return executor.query(caller, tx -> queries.batchGetReputations(tx, actors, dimension));
    }

    public List<ReputationView> batchGetReputations(String caller, String commaSeparatedActors, String dimension) {
        return executor.query(caller, tx -> queries.batchGetReputations(tx, commaSeparatedActors, dimension));
    }

    public AgentProfile getAgentProfile(String caller, String actor) {
        return executor.query(caller, tx -> queries.agentProfile(tx, actor));
    }

    public List<String> getAllActors(String caller) {
        return executor.query(caller, queries::allActors);
    }

    public Reputation resetReputation(String caller, String actor, String dimension) {
        return executor.execute(caller, "resetReputation", tx -> reputationService.reset(tx,
                configurationService.getConfig(tx),
                IdentityNormalizer.normalize(actor), dimension));
    }

    // ==================== Metrics ====================

    public SystemMetrics getSystemMetrics(String caller) {
        return executor.query(caller, metrics::current);
    }

    public SystemMetrics rebuildMetrics(String caller) {
        return executor.execute(caller, "rebuildMetrics", metrics::rebuild);
    }
}
