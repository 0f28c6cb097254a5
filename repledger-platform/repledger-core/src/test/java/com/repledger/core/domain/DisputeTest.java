package com.repledger.core.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class DisputeTest {

    private static final Instant OPENED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant CLOSED = OPENED.plusSeconds(3_600);

    private final Rating rating = new Rating("RAT-1", "alice", "bob", "quality", 0.05, 0.1,
            "ipfs://evidence", OPENED, "tx-1");

    @Test
    void openCopiesRatingParties() {
        Dispute dispute = Dispute.open("DIS-1", rating, "bob", "never shipped", new BigDecimal("100"), OPENED);

        assertThat(dispute.isPending()).isTrue();
        assertThat(dispute.raterId()).isEqualTo("alice");
        assertThat(dispute.targetId()).isEqualTo("bob");
        assertThat(dispute.dimension()).isEqualTo("quality");
        assertThat(dispute.slashedAmount()).isEqualByComparingTo("0");
    }

    @Test
    void resolveIsTerminal() {
        Dispute dispute = Dispute.open("DIS-1", rating, "bob", "never shipped", new BigDecimal("100"), OPENED);

        Dispute resolved = dispute.resolve(Verdict.OVERTURNED, "arbitrator", "no evidence", new BigDecimal("30"), CLOSED);

        assertThat(resolved.status()).isEqualTo(DisputeStatus.OVERTURNED);
        assertThat(resolved.status().isTerminal()).isTrue();
        assertThat(resolved.resolvedAt()).isEqualTo(CLOSED);
        assertThatIllegalStateException()
                .isThrownBy(() -> resolved.resolve(Verdict.UPHELD, "arbitrator", "again", BigDecimal.ZERO, CLOSED));
    }

    @Test
    void verdictParsingIsCaseInsensitive() {
        assertThat(Verdict.parse(" Upheld ")).contains(Verdict.UPHELD);
        assertThat(Verdict.parse("OVERTURNED")).contains(Verdict.OVERTURNED);
        assertThat(Verdict.parse("pending")).isEmpty();
        assertThat(Verdict.parse(null)).isEmpty();
    }
}
