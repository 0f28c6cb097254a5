package com.repledger.core.error;

/**
 * Thrown when the state store rejects a commit because a key read by the transaction was
 * changed by a concurrent commit. The caller should retry with identical inputs.
 */
public class StorageConflictException extends LedgerException {

    private final String conflictingKey;

    public StorageConflictException(String conflictingKey) {
        super(LedgerErrorKind.STORAGE_CONFLICT, "Concurrent modification of " + printable(conflictingKey));
        this.conflictingKey = conflictingKey;
    }

    public StorageConflictException(String conflictingKey, Throwable cause) {
        super(LedgerErrorKind.STORAGE_CONFLICT, "Concurrent modification of " + printable(conflictingKey), cause);
        this.conflictingKey = conflictingKey;
    }

    public String conflictingKey() {
        return conflictingKey;
    }

    private static String printable(String key) {
        return key == null ? "<unknown>" : key.replace('\u0000', '/');
    }
}
