package com.repledger.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Arbitrator decision on a disputed rating.
 * UPHELD means the original rating stands, OVERTURNED means it was false.
 */
public enum Verdict {
    UPHELD(DisputeStatus.UPHELD),
    OVERTURNED(DisputeStatus.OVERTURNED);

    private final DisputeStatus status;

    Verdict(DisputeStatus status) {
        this.status = status;
    }

    public DisputeStatus status() {
        return status;
    }

    public static Optional<Verdict> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "upheld" -> Optional.of(UPHELD);
            case "overturned" -> Optional.of(OVERTURNED);
            default -> Optional.empty();
        };
    }
}
