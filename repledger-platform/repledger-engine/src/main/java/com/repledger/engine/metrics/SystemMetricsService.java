package com.repledger.engine.metrics;

import com.repledger.core.domain.Dispute;
import com.repledger.core.domain.DisputeStatus;
import com.repledger.core.domain.Rating;
import com.repledger.core.domain.SystemMetrics;
import com.repledger.core.domain.Verdict;
import com.repledger.core.error.StorageConflictException;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerNotification;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.core.ledger.StateCodec;
import com.repledger.core.ledger.StateStore;
import com.repledger.engine.config.ReputationEngineProperties;
import com.repledger.engine.identity.AccessPolicy;
import com.repledger.engine.ledger.NotificationTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Maintains the global {@link SystemMetrics} counters.
 *
 * <p>Counters are advanced after the originating operation has committed, in a transaction of
 * their own, so concurrent ratings never conflict on the shared metrics record. A failed update is
 * retried a few times and then dropped with a warning; {@link #rebuild} recomputes the counters from
 * the authoritative ratings and disputes.
 */
@Service
public class SystemMetricsService {

    private static final Logger log = LoggerFactory.getLogger(SystemMetricsService.class);

    static final String SYSTEM_CALLER = "repledger-metrics";

    private final StateStore store;
    private final StateCodec codec;
    private final Clock clock;
    private final AccessPolicy accessPolicy;
    private final int maxAttempts;

    public SystemMetricsService(StateStore store, StateCodec codec, Clock clock,
                                AccessPolicy accessPolicy, ReputationEngineProperties properties) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.accessPolicy = accessPolicy;
        this.maxAttempts = properties.getMetrics().getMaxAttempts();
    }

    @EventListener
    public void onNotification(LedgerNotification notification) {
        UnaryOperator<SystemMetrics> change = changeFor(notification);
        if (change == null) {
            return;
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                LedgerTransaction tx = LedgerTransaction.begin(store, codec, SYSTEM_CALLER, clock);
                tx.put(LedgerKeys.metrics(), change.apply(current(tx)));
                tx.commit();
                return;
            } catch (StorageConflictException e) {
                log.debug("Metrics update for {} conflicted (attempt {}/{})", notification.topic(), attempt, maxAttempts);
            } catch (RuntimeException e) {
                log.warn("Metrics update for {} from tx {} failed", notification.topic(), notification.txId(), e);
                return;
            }
        }
        log.warn("Metrics update for {} from tx {} dropped after {} attempts",
                notification.topic(), notification.txId(), maxAttempts);
    }

    public SystemMetrics current(LedgerTransaction tx) {
        return tx.get(LedgerKeys.metrics(), SystemMetrics.class)
                .orElseGet(() -> SystemMetrics.empty(tx.timestamp()));
    }

    /**
     * Admin-only: recomputes every counter from stored ratings and disputes.
     */
    public SystemMetrics rebuild(LedgerTransaction tx) {
        accessPolicy.requireAdmin(tx.callerId(), "rebuild metrics");
        List<Rating> ratings = tx.range(LedgerKeys.prefix(LedgerKeys.RATING), Rating.class);
        List<Dispute> disputes = tx.range(LedgerKeys.prefix(LedgerKeys.DISPUTE), Dispute.class);

        long upheld = disputes.stream().filter(d -> d.status() == DisputeStatus.UPHELD).count();
        long overturned = disputes.stream().filter(d -> d.status() == DisputeStatus.OVERTURNED).count();
        BigDecimal slashed = disputes.stream()
                .map(Dispute::slashedAmount)
                .filter(amount -> amount != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        SystemMetrics rebuilt = new SystemMetrics(ratings.size(), disputes.size(), upheld, overturned,
                slashed, tx.timestamp());
        tx.put(LedgerKeys.metrics(), rebuilt);
        log.info("Metrics rebuilt by {}: {} ratings, {} disputes", tx.callerId(), ratings.size(), disputes.size());
        return rebuilt;
    }

    private static UnaryOperator<SystemMetrics> changeFor(LedgerNotification notification) {
        return switch (notification.topic()) {
            case NotificationTopics.RATING_SUBMITTED ->
                    metrics -> metrics.ratingSubmitted(notification.emittedAt());
            case NotificationTopics.DISPUTE_INITIATED ->
                    metrics -> metrics.disputeInitiated(notification.emittedAt());
            case NotificationTopics.DISPUTE_RESOLVED -> {
                Verdict verdict = Verdict.parse(String.valueOf(notification.get("verdict")))
                        .orElseThrow(() -> new IllegalStateException("Resolution notice without verdict"));
                BigDecimal slashed = new BigDecimal(String.valueOf(notification.get("slashed")));
                yield metrics -> metrics.disputeResolved(verdict, slashed, notification.emittedAt());
            }
            default -> null;
        };
    }
}
