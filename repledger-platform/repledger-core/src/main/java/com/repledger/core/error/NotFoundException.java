package com.repledger.core.error;

/**
 * Thrown when a referenced rating, dispute or other record does not exist.
 */
public class NotFoundException extends LedgerException {

    private final String recordType;
    private final String recordId;

    public NotFoundException(String recordType, String recordId) {
        super(LedgerErrorKind.NOT_FOUND, recordType + " not found: " + recordId);
        this.recordType = recordType;
        this.recordId = recordId;
    }

    public String recordType() {
        return recordType;
    }

    public String recordId() {
        return recordId;
    }
}
