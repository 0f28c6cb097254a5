package com.repledger.core.domain;

public enum DisputeStatus {
    PENDING,
    UPHELD,
    OVERTURNED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
