package com.repledger.store.jpa;

import com.repledger.core.error.StorageConflictException;
import com.repledger.core.ledger.StateStore;
import com.repledger.core.ledger.VersionedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link StateStore} over a single relational table.
 *
 * <p>Every key in the read set is reloaded with an optimistic lock inside one database transaction
 * and compared with the version the ledger transaction saw. Writes then go through the entity
 * version column, so a concurrent commit on any touched row makes this one fail with
 * {@link StorageConflictException}.
 */
public class JpaStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStateStore.class);

    private final LedgerEntryRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaStateStore(LedgerEntryRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<VersionedState> read(String key) {
        return repository.findById(StorageKeys.encode(key)).map(JpaStateStore::toState);
    }

    @Override
    public List<VersionedState> scan(String keyPrefix) {
        List<VersionedState> states = new ArrayList<>();
        for (LedgerEntry entry : repository.findByStateKeyStartingWithOrderByStateKeyAsc(StorageKeys.encode(keyPrefix))) {
            states.add(toState(entry));
        }
        states.sort(Comparator.comparing(VersionedState::key));
        return states;
    }

    @Override
    public void commit(Map<String, Long> readVersions, Map<String, byte[]> writes) throws StorageConflictException {
        try {
            transactionTemplate.executeWithoutResult(status -> apply(readVersions, writes));
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            String key = writes.keySet().stream().findFirst().orElse("<none>");
            log.debug("Commit rejected by the database: {}", e.getMessage());
            throw new StorageConflictException(key, e);
        }
    }

    private void apply(Map<String, Long> readVersions, Map<String, byte[]> writes) {
        Map<String, LedgerEntry> loaded = new HashMap<>();
        for (Map.Entry<String, Long> read : readVersions.entrySet()) {
            Optional<LedgerEntry> current = repository.findWithVersionCheckByStateKey(StorageKeys.encode(read.getKey()));
            long actual = current.map(LedgerEntry::ledgerVersion).orElse(VersionedState.ABSENT);
            if (actual != read.getValue()) {
                log.debug("Version mismatch on {}: read {}, now {}", read.getKey(), read.getValue(), actual);
                throw new StorageConflictException(read.getKey());
            }
            current.ifPresent(entry -> loaded.put(read.getKey(), entry));
        }

        for (Map.Entry<String, byte[]> write : writes.entrySet()) {
            String value = new String(write.getValue(), StandardCharsets.UTF_8);
            LedgerEntry entry = loaded.get(write.getKey());
            if (entry == null) {
                entry = repository.findById(StorageKeys.encode(write.getKey())).orElse(null);
            }
            if (entry == null) {
                repository.save(LedgerEntry.create(StorageKeys.encode(write.getKey()), value, clock.instant()));
            } else {
                entry.overwrite(value, clock.instant());
            }
        }
        repository.flush();
    }

    private static VersionedState toState(LedgerEntry entry) {
        return new VersionedState(StorageKeys.decode(entry.getStateKey()),
                entry.getStateValue().getBytes(StandardCharsets.UTF_8),
                entry.ledgerVersion());
    }
}
