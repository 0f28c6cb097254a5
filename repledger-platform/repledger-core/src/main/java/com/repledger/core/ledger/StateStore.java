package com.repledger.core.ledger;

import com.repledger.core.error.StorageConflictException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store with per-commit atomicity and optimistic conflict detection.
 *
 * <p>A commit succeeds only if every key in {@code readVersions} still carries the version the
 * transaction observed ({@link VersionedState#ABSENT} for keys that did not exist). Otherwise the
 * whole commit is rejected and nothing is applied.
 */
public interface StateStore {

    Optional<VersionedState> read(String key);

    /**
     * Returns every entry whose key starts with {@code keyPrefix}, ordered by key.
     */
    List<VersionedState> scan(String keyPrefix);

    void commit(Map<String, Long> readVersions, Map<String, byte[]> writes) throws StorageConflictException;
}
