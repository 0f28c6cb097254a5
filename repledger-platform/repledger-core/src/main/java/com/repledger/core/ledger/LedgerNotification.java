package com.repledger.core.ledger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive change event emitted by a committed transaction for external observers.
 */
public record LedgerNotification(String topic, Map<String, Object> payload, String txId, Instant emittedAt) {

    public LedgerNotification {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object get(String field) {
        return payload.get(field);
    }
}
