package com.repledger.store.jpa;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByStateKeyStartingWithOrderByStateKeyAsc(String prefix);

    /**
     * Loads a row and has the provider re-check its version when the surrounding transaction commits.
     */
    @Lock(LockModeType.OPTIMISTIC)
    Optional<LedgerEntry> findWithVersionCheckByStateKey(String stateKey);
}
