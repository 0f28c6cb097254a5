package com.repledger.core.error;

/**
 * Thrown when an input value, timestamp, dimension, amount or configuration is malformed
 * or out of range.
 */
public class InvalidInputException extends LedgerException {

    private final Reason reason;

    public InvalidInputException(Reason reason, String message) {
        super(LedgerErrorKind.INVALID_INPUT, message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        INVALID_VALUE,
        INVALID_TIMESTAMP,
        INVALID_DIMENSION,
        INVALID_AMOUNT,
        INVALID_CONFIG,
        INVALID_VERDICT,
        INVALID_CONFIDENCE,
        NO_META_DIMENSION,
        RATING_ID_COLLISION,
        MISSING_ARGUMENT
    }
}
