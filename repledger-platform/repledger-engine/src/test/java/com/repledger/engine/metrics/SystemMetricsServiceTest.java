package com.repledger.engine.metrics;

import com.repledger.core.domain.SystemMetrics;
import com.repledger.core.error.StorageConflictException;
import com.repledger.core.error.UnauthorizedException;
import com.repledger.core.ledger.InMemoryStateStore;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerNotification;
import com.repledger.core.ledger.StateCodec;
import com.repledger.engine.config.ReputationEngineProperties;
import com.repledger.engine.identity.AccessPolicy;
import com.repledger.engine.support.LedgerFixture;
import com.repledger.engine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SystemMetricsServiceTest {

    @Test
    void countersFollowCommittedOperations() {
        LedgerFixture fixture = new LedgerFixture();
        fixture.fund("alice", 2000);
        fixture.fund("bob", 500);
        String rating = fixture.rate("alice", "bob", "quality", 0.0);
        String dispute = fixture.ledger.initiateDispute("bob", rating, "unfair");
        fixture.ledger.resolveDispute("arbitrator", dispute, "overturned", null);

        SystemMetrics metrics = fixture.ledger.getSystemMetrics("anyone");

        assertThat(metrics.totalRatings()).isEqualTo(1);
        assertThat(metrics.totalDisputes()).isEqualTo(1);
        assertThat(metrics.disputesOverturned()).isEqualTo(1);
        assertThat(metrics.disputesUpheld()).isZero();
        assertThat(metrics.totalStakeSlashed()).isEqualByComparingTo("600");
    }

    @Test
    void rebuildRecomputesFromRecords() {
        LedgerFixture fixture = new LedgerFixture();
        fixture.fund("alice", 1000);
        fixture.rate("alice", "bob", "quality", 0.8);
        fixture.store.commit(Map.of(), Map.of(LedgerKeys.metrics(),
                fixture.codec.encode(SystemMetrics.empty(fixture.clock.instant()))));

        assertThatThrownBy(() -> fixture.ledger.rebuildMetrics("alice")).isInstanceOf(UnauthorizedException.class);
        SystemMetrics rebuilt = fixture.ledger.rebuildMetrics("admin");

        assertThat(rebuilt.totalRatings()).isEqualTo(1);
        assertThat(fixture.ledger.getSystemMetrics("anyone")).isEqualTo(rebuilt);
    }

    @Test
    void persistentConflictsAreDroppedNotThrown() {
        AtomicInteger attempts = new AtomicInteger();
        InMemoryStateStore alwaysConflicting = new InMemoryStateStore() {
            @Override
            public synchronized void commit(Map<String, Long> readVersions, Map<String, byte[]> writes) {
                attempts.incrementAndGet();
                throw new StorageConflictException(LedgerKeys.metrics());
            }
        };
        ReputationEngineProperties properties = new ReputationEngineProperties();
        SystemMetricsService service = new SystemMetricsService(alwaysConflicting, new StateCodec(),
                new MutableClock(LedgerFixture.START), new AccessPolicy(properties), properties);

        assertThatCode(() -> service.onNotification(new LedgerNotification("rating.submitted", Map.of(), "tx-1",
                LedgerFixture.START))).doesNotThrowAnyException();
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void unrelatedTopicsAreIgnored() {
        LedgerFixture fixture = new LedgerFixture();
        fixture.fund("alice", 10);

        assertThat(fixture.store.read(LedgerKeys.metrics())).isEmpty();
    }
}
