package com.repledger.core.error;

/**
 * Thrown when an actor attempts to rate themselves.
 */
public class SelfRatingForbiddenException extends LedgerException {

    public SelfRatingForbiddenException(String actorId) {
        super(LedgerErrorKind.SELF_RATING_FORBIDDEN, "Actor cannot rate itself: " + actorId);
    }
}
