package com.repledger.engine.ledger;

import com.repledger.core.ledger.LedgerNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Broadcasts notifications as application events; listeners pick them up with {@code @EventListener}.
 */
@Component
public class SpringNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringNotificationPublisher.class);

    private final ApplicationEventPublisher eventPublisher;

    public SpringNotificationPublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void publish(LedgerNotification notification) {
        log.debug("Publishing {} from tx {}", notification.topic(), notification.txId());
        eventPublisher.publishEvent(notification);
    }
}
