package com.repledger.core.ledger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RecordIdsTest {

    @Test
    void ratingIdIsDeterministicAndPrefixed() {
        String id = RecordIds.ratingId("alice", "bob", "quality", 1_700_000_000L);

        assertThat(id).isEqualTo(RecordIds.ratingId("alice", "bob", "quality", 1_700_000_000L));
        assertThat(id).startsWith("RAT-").hasSize(4 + 16).matches("RAT-[0-9a-f]{16}");
    }

    @Test
    void anyInputChangeGivesNewRatingId() {
        String base = RecordIds.ratingId("alice", "bob", "quality", 1L);

        assertThat(RecordIds.ratingId("alice", "bob", "quality", 2L)).isNotEqualTo(base);
        assertThat(RecordIds.ratingId("alice", "bob", "delivery", 1L)).isNotEqualTo(base);
        assertThat(RecordIds.ratingId("bob", "alice", "quality", 1L)).isNotEqualTo(base);
    }

    @Test
    void disputeIdDependsOnRatingAndInitiator() {
        String id = RecordIds.disputeId("RAT-0011223344556677", "bob");

        assertThat(id).matches("DIS-[0-9a-f]{16}");
        assertThat(RecordIds.disputeId("RAT-0011223344556677", "carol")).isNotEqualTo(id);
    }

    @Test
    void separatorInsideAnIdentityDoesNotShiftIntoTheNextPart() {
        assertThat(RecordIds.ratingId("a:b", "c", "quality", 1L))
                .isNotEqualTo(RecordIds.ratingId("a", "b:c", "quality", 1L));
        assertThat(RecordIds.disputeId("RAT-1:x", "y"))
                .isNotEqualTo(RecordIds.disputeId("RAT-1", "x:y"));
    }

    @Test
    void escapeCharacterIsItselfEscaped() {
        assertThat(RecordIds.join("a%3Ab", "c")).isNotEqualTo(RecordIds.join("a:b", "c"));
        assertThat(RecordIds.join("a%3Ab", "c")).isEqualTo("a%253Ab:c");
    }

    @Test
    void plainPartsKeepTheColonJoinedLayout() {
        assertThat(RecordIds.join("alice", "bob", "quality", "1700000000"))
                .isEqualTo("alice:bob:quality:1700000000");
    }
}
