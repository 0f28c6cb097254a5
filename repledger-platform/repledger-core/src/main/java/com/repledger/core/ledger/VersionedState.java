package com.repledger.core.ledger;

/**
 * A stored value together with the version the store assigned at its last commit.
 */
public record VersionedState(String key, byte[] value, long version) {

    /** Version observed for a key that has never been written. */
    public static final long ABSENT = 0L;
}
