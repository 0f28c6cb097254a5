package com.repledger.core.error;

/**
 * Thrown when a dispute that already reached a terminal status is resolved or re-opened.
 */
public class AlreadyResolvedException extends LedgerException {

    public AlreadyResolvedException(String disputeId) {
        super(LedgerErrorKind.ALREADY_RESOLVED, "Dispute already resolved: " + disputeId);
    }
}
