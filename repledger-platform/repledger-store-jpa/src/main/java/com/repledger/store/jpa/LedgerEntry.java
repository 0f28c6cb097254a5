package com.repledger.store.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

/**
 * One key-value row of ledger state. The JPA version column doubles as the optimistic
 * concurrency token handed to {@link com.repledger.core.ledger.LedgerTransaction}.
 */
@Entity
@Table(name = "ledger_state")
public class LedgerEntry {

    @Id
    @Column(name = "state_key", nullable = false, length = 1024)
    private String stateKey;

    @Column(name = "state_value", nullable = false, length = 16384)
    private String stateValue;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected LedgerEntry() {}

    public static LedgerEntry create(String stateKey, String stateValue, Instant now) {
        LedgerEntry entry = new LedgerEntry();
        entry.stateKey = stateKey;
        entry.stateValue = stateValue;
        entry.updatedAt = now;
        return entry;
    }

    public void overwrite(String newValue, Instant now) {
        this.stateValue = newValue;
        this.updatedAt = now;
    }

    /**
     * Version as seen by ledger transactions: 1 for a freshly inserted row, 0 is reserved for absent keys.
     */
    public long ledgerVersion() {
        return rowVersion == null ? 0L : rowVersion + 1;
    }

    // Getters
    public String getStateKey() { return stateKey; }
    public String getStateValue() { return stateValue; }
    public Long getRowVersion() { return rowVersion; }
    public Instant getUpdatedAt() { return updatedAt; }
}
