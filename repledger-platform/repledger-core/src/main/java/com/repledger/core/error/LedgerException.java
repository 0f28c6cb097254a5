package com.repledger.core.error;

/**
 * Base type for every error the engine returns to its caller.
 * Only {@link LedgerErrorKind#STORAGE_CONFLICT} is worth retrying with the same inputs;
 * every other kind is terminal for the call.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    protected LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LedgerErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind == LedgerErrorKind.STORAGE_CONFLICT;
    }
}
