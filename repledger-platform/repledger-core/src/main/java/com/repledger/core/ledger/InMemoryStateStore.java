package com.repledger.core.ledger;

import com.repledger.core.error.StorageConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link StateStore}. Commits are serialized on the store monitor; reads are lock-free.
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final NavigableMap<String, VersionedState> entries = new ConcurrentSkipListMap<>();

    @Override
    public Optional<VersionedState> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public List<VersionedState> scan(String keyPrefix) {
        List<VersionedState> result = new ArrayList<>();
        for (Map.Entry<String, VersionedState> entry : entries.tailMap(keyPrefix, true).entrySet()) {
            if (!entry.getKey().startsWith(keyPrefix)) {
                break;
            }
            result.add(entry.getValue());
        }
        return result;
    }

    @Override
    public synchronized void commit(Map<String, Long> readVersions, Map<String, byte[]> writes) {
        for (Map.Entry<String, Long> read : readVersions.entrySet()) {
            VersionedState current = entries.get(read.getKey());
            long currentVersion = current == null ? VersionedState.ABSENT : current.version();
            if (currentVersion != read.getValue()) {
                log.debug("Rejecting commit: {} moved from version {} to {}",
                        read.getKey(), read.getValue(), currentVersion);
                throw new StorageConflictException(read.getKey());
            }
        }
        for (Map.Entry<String, byte[]> write : writes.entrySet()) {
            VersionedState current = entries.get(write.getKey());
            long nextVersion = (current == null ? VersionedState.ABSENT : current.version()) + 1;
            entries.put(write.getKey(), new VersionedState(write.getKey(), write.getValue().clone(), nextVersion));
        }
    }

    public int size() {
        return entries.size();
    }
}
