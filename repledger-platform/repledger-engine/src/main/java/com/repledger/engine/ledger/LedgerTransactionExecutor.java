package com.repledger.engine.ledger;

import com.repledger.core.error.LedgerException;
import com.repledger.core.error.StorageConflictException;
import com.repledger.core.ledger.LedgerNotification;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.core.ledger.StateCodec;
import com.repledger.core.ledger.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.Function;

/**
 * Runs each public operation as one {@link LedgerTransaction}.
 *
 * <p>Write operations commit once at the end; a rejected commit surfaces as
 * {@link StorageConflictException} and nothing is retried here. Notifications are published only
 * after a successful commit and their delivery never fails the operation.
 */
@Component
public class LedgerTransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransactionExecutor.class);

    private final StateStore store;
    private final StateCodec codec;
    private final Clock clock;
    private final NotificationPublisher publisher;

    public LedgerTransactionExecutor(StateStore store, StateCodec codec, Clock clock, NotificationPublisher publisher) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.publisher = publisher;
    }

    public <T> T execute(String caller, String operation, Function<LedgerTransaction, T> work) {
        LedgerTransaction tx = LedgerTransaction.begin(store, codec, caller, clock);
        T result;
        try {
            result = work.apply(tx);
        } catch (LedgerException e) {
            log.debug("{} rejected for tx {}: {}", operation, tx.txId(), e.getMessage());
            throw e;
        }
        if (tx.hasWrites()) {
            try {
                tx.commit();
            } catch (StorageConflictException e) {
                log.info("{} lost a write conflict on tx {}; caller should retry", operation, tx.txId());
                throw e;
            }
        }
        publishAll(tx);
        return result;
    }

    /**
     * Runs read-only work. The transaction is discarded, so auto-initialized records are not persisted.
     */
    public <T> T query(String caller, Function<LedgerTransaction, T> work) {
        return work.apply(LedgerTransaction.begin(store, codec, caller, clock));
    }

    private void publishAll(LedgerTransaction tx) {
        for (LedgerNotification notification : tx.notifications()) {
            try {
                publisher.publish(notification);
            } catch (RuntimeException e) {
                log.warn("Notification {} from tx {} was not delivered", notification.topic(), tx.txId(), e);
            }
        }
    }
}
