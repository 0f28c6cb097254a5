package com.repledger.engine.reputation;

/**
 * Closed interval within [0,1] around a reputation score.
 */
public record ConfidenceInterval(double lower, double upper, ConfidenceLevel level) {

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
