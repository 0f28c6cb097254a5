package com.repledger.core.ledger;

/**
 * Composite key layout. Each key is a record-type prefix followed by its attributes, every part
 * terminated by a NUL separator so that prefix scans never bleed into neighbouring actors.
 */
public final class LedgerKeys {

    public static final String CONFIG = "CFG";
    public static final String REPUTATION = "REP";
    public static final String RATING = "RAT";
    public static final String STAKE = "STK";
    public static final String DISPUTE = "DIS";
    public static final String METRICS = "MET";
    public static final String SUSPICIOUS = "SUS";

    private static final char SEPARATOR = '\u0000';
    private static final String GLOBAL = "global";

    private LedgerKeys() {
    }

    public static String composite(String recordType, String... attributes) {
        StringBuilder key = new StringBuilder(recordType).append(SEPARATOR);
        for (String attribute : attributes) {
            key.append(attribute).append(SEPARATOR);
        }
        return key.toString();
    }

    public static String prefix(String recordType) {
        return composite(recordType);
    }

    public static String config() {
        return composite(CONFIG, GLOBAL);
    }

    public static String metrics() {
        return composite(METRICS, GLOBAL);
    }

    public static String reputation(String actorId, String dimension) {
        return composite(REPUTATION, actorId, dimension);
    }

    public static String rating(String ratingId) {
        return composite(RATING, ratingId);
    }

    public static String stake(String actorId) {
        return composite(STAKE, actorId);
    }

    public static String dispute(String disputeId) {
        return composite(DISPUTE, disputeId);
    }

    public static String suspicious(String ratingId) {
        return composite(SUSPICIOUS, ratingId);
    }
}
