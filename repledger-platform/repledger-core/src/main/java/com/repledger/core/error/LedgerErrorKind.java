package com.repledger.core.error;

/**
 * Error categories surfaced to callers of the ledger engine.
 */
public enum LedgerErrorKind {
    INVALID_INPUT,
    UNAUTHORIZED,
    INSUFFICIENT_STAKE,
    NOT_FOUND,
    ALREADY_RESOLVED,
    SELF_RATING_FORBIDDEN,
    STORAGE_CONFLICT
}
