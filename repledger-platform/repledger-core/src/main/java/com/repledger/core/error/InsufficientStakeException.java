package com.repledger.core.error;

import java.math.BigDecimal;

/**
 * Thrown when an actor's available stake does not cover a requirement.
 */
public class InsufficientStakeException extends LedgerException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientStakeException(String actorId, BigDecimal required, BigDecimal available) {
        super(LedgerErrorKind.INSUFFICIENT_STAKE,
                "Insufficient stake for " + actorId + ": need " + required.toPlainString()
                        + ", have " + available.toPlainString() + " available");
        this.required = required;
        this.available = available;
    }

    public BigDecimal required() {
        return required;
    }

    public BigDecimal available() {
        return available;
    }
}
