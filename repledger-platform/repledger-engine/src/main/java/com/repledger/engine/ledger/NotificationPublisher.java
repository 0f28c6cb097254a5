package com.repledger.engine.ledger;

import com.repledger.core.ledger.LedgerNotification;

/**
 * Fire-and-forget delivery of change notifications to external observers.
 */
public interface NotificationPublisher {

    void publish(LedgerNotification notification);
}
