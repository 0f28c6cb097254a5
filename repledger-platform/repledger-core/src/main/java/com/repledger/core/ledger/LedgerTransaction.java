package com.repledger.core.ledger;

import com.repledger.core.error.StorageConflictException;
import com.repledger.core.error.UnauthorizedException;
import com.repledger.core.identity.IdentityNormalizer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One unit of work against the {@link StateStore}.
 *
 * <p>Reads go to the store (or to this transaction's own pending writes) and remember the version
 * observed. Writes and notifications are buffered until {@link #commit()}, which hands the read set
 * and the write set to the store in a single atomic step. A transaction that is never committed
 * leaves no trace, which is how read-only queries run.
 */
public class LedgerTransaction {

    private final StateStore store;
    private final StateCodec codec;
    private final String txId;
    private final String callerId;
    private final Instant timestamp;

    private final Map<String, Long> readVersions = new HashMap<>();
    private final Map<String, byte[]> writes = new LinkedHashMap<>();
    private final List<LedgerNotification> notifications = new ArrayList<>();
    private boolean committed;

    public LedgerTransaction(StateStore store, StateCodec codec, String txId, String rawCaller, Instant timestamp) {
        this.store = store;
        this.codec = codec;
        this.txId = txId;
        this.callerId = IdentityNormalizer.normalize(rawCaller);
        this.timestamp = timestamp;
    }

    public static LedgerTransaction begin(StateStore store, StateCodec codec, String rawCaller, Clock clock) {
        return new LedgerTransaction(store, codec, UUID.randomUUID().toString(), rawCaller, clock.instant());
    }

    public String txId() {
        return txId;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Normalized identity of the caller; fails for anonymous transactions.
     */
    public String callerId() {
        if (callerId.isEmpty()) {
            throw new UnauthorizedException("Caller identity is required");
        }
        return callerId;
    }

    // ==================== State access ====================

    public <T> Optional<T> get(String key, Class<T> type) {
        byte[] pending = writes.get(key);
        if (pending != null) {
            return Optional.of(codec.decode(pending, type));
        }
        Optional<VersionedState> state = store.read(key);
        readVersions.putIfAbsent(key, state.map(VersionedState::version).orElse(VersionedState.ABSENT));
        return state.map(s -> codec.decode(s.value(), type));
    }

    public boolean exists(String key) {
        if (writes.containsKey(key)) {
            return true;
        }
        Optional<VersionedState> state = store.read(key);
        readVersions.putIfAbsent(key, state.map(VersionedState::version).orElse(VersionedState.ABSENT));
        return state.isPresent();
    }

    public void put(String key, Object value) {
        ensureOpen();
        writes.put(key, codec.encode(value));
    }

    /**
     * Range query over one record type. Results include this transaction's pending writes and are
     * ordered by key.
     */
    public <T> List<T> range(String keyPrefix, Class<T> type) {
        Map<String, byte[]> merged = new TreeMap<>();
        for (VersionedState state : store.scan(keyPrefix)) {
            readVersions.putIfAbsent(state.key(), state.version());
            merged.put(state.key(), state.value());
        }
        writes.forEach((key, value) -> {
            if (key.startsWith(keyPrefix)) {
                merged.put(key, value);
            }
        });
        List<T> result = new ArrayList<>(merged.size());
        for (byte[] value : merged.values()) {
            result.add(codec.decode(value, type));
        }
        return result;
    }

    // ==================== Notifications ====================

    public void emit(String topic, Map<String, Object> payload) {
        ensureOpen();
        notifications.add(new LedgerNotification(topic, payload, txId, timestamp));
    }

    public List<LedgerNotification> notifications() {
        return Collections.unmodifiableList(notifications);
    }

    // ==================== Commit ====================

    public void commit() throws StorageConflictException {
        ensureOpen();
        store.commit(Collections.unmodifiableMap(readVersions), Collections.unmodifiableMap(writes));
        committed = true;
    }

    public boolean hasWrites() {
        return !writes.isEmpty();
    }

    public boolean isCommitted() {
        return committed;
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Transaction " + txId + " is already committed");
        }
    }
}
