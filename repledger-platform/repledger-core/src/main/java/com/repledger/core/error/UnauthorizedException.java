package com.repledger.core.error;

/**
 * Thrown when a role or ownership check fails.
 */
public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(LedgerErrorKind.UNAUTHORIZED, message);
    }
}
