package com.repledger.engine.reputation;

import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;

/**
 * Supported two-sided confidence levels for the Wilson interval.
 */
public enum ConfidenceLevel {
    P95(0.95, 1.96),
    P99(0.99, 2.576);

    private final double level;
    private final double z;

    ConfidenceLevel(double level, double z) {
        this.level = level;
        this.z = z;
    }

    public double level() {
        return level;
    }

    public double z() {
        return z;
    }

    public static ConfidenceLevel fromValue(double confidence) {
        for (ConfidenceLevel candidate : values()) {
            if (Math.abs(candidate.level - confidence) < 1e-9) {
                return candidate;
            }
        }
        throw new InvalidInputException(Reason.INVALID_CONFIDENCE,
                "Unsupported confidence level " + confidence + "; use 0.95 or 0.99");
    }
}
