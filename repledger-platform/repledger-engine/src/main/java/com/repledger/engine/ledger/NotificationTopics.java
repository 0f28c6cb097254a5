package com.repledger.engine.ledger;

/**
 * Topics of the change notifications emitted after a successful commit.
 */
public final class NotificationTopics {

    public static final String CONFIG_INITIALIZED = "config.initialized";
    public static final String CONFIG_UPDATED = "config.updated";
    public static final String DIMENSION_ADDED = "config.dimension_added";
    public static final String STAKE_DEPOSITED = "stake.deposited";
    public static final String STAKE_SLASHED = "stake.slashed";
    public static final String RATING_SUBMITTED = "rating.submitted";
    public static final String RATING_SUSPICIOUS = "rating.suspicious";
    public static final String DISPUTE_INITIATED = "dispute.initiated";
    public static final String DISPUTE_RESOLVED = "dispute.resolved";
    public static final String REPUTATION_RESET = "reputation.reset";

    private NotificationTopics() {
    }
}
