package com.repledger.engine.config;

import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.UnauthorizedException;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.engine.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ConfigurationServiceTest {

    private LedgerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
    }

    private static SystemConfig proposal(double slashFraction, Set<String> dims, Map<String, String> metas) {
        return new SystemConfig(new BigDecimal("500"), new BigDecimal("50"), slashFraction, 0.95, 3_600L,
                1.0, 1.0, 0.2, 4.0, dims, metas, 0L, null);
    }

    @Test
    void defaultsAreServedWithoutBeingStoredByQueries() {
        SystemConfig config = fixture.ledger.getConfig("anyone");

        assertThat(config.version()).isEqualTo(1L);
        assertThat(config.minStake()).isEqualByComparingTo("1000");
        assertThat(config.disputeCost()).isEqualByComparingTo("100");
        assertThat(config.slashFraction()).isEqualTo(0.30);
        assertThat(config.decayRate()).isEqualTo(0.98);
        assertThat(config.decayPeriodSeconds()).isEqualTo(86_400L);
        assertThat(config.validDimensions()).containsExactly("compliance", "delivery", "quality", "warranty");
        assertThat(config.metaDimensionFor("warranty")).contains("rater_warranty");
        assertThat(fixture.store.read(LedgerKeys.config())).isEmpty();
    }

    @Test
    void initConfigIsAdminOnlyAndIdempotent() {
        assertThatThrownBy(() -> fixture.ledger.initConfig("alice")).isInstanceOf(UnauthorizedException.class);

        SystemConfig first = fixture.ledger.initConfig("admin");
        SystemConfig second = fixture.ledger.initConfig("CN=Admin,OU=admin");

        assertThat(second).isEqualTo(first);
        assertThat(fixture.topics()).containsExactly("config.initialized");
    }

    @Test
    void updateBumpsVersionAndAnnouncesChanges() {
        fixture.ledger.initConfig("admin");

        SystemConfig updated = fixture.ledger.updateConfig("admin",
                proposal(0.5, Set.of("quality"), Map.of("quality", "rater_quality")));

        assertThat(updated.version()).isEqualTo(2L);
        assertThat(updated.updatedAt()).isEqualTo(fixture.clock.instant());
        assertThat(fixture.ledger.getConfig("anyone")).isEqualTo(updated);
        assertThat(fixture.published).last().satisfies(n -> {
            assertThat(n.topic()).isEqualTo("config.updated");
            assertThat((String) n.get("changes")).contains("slashFraction: 0.3 -> 0.5");
        });
    }

    @Test
    void nonAdminCannotUpdate() {
        assertThatThrownBy(() -> fixture.ledger.updateConfig("alice",
                proposal(0.5, Set.of("quality"), Map.of("quality", "rater_quality"))))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void everyViolationIsReported() {
        SystemConfig invalid = new SystemConfig(new BigDecimal("-1"), new BigDecimal("5"), 1.5, -0.1, 0L,
                0.0, 1.0, 3.0, 2.0, Set.of("quality"), Map.of("quality", "quality"), 0L, null);

        List<String> violations = ConfigurationService.validate(invalid);

        assertThat(violations).hasSize(7);
        assertThatThrownBy(() -> fixture.ledger.updateConfig("admin", invalid))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("slashFraction")
                .hasMessageContaining("maxRaterWeight must be >= minRaterWeight");
    }

    @Test
    void addDimensionExtendsBothSetAndMapping() {
        SystemConfig updated = fixture.ledger.addDimension("admin", "packaging", "rater_packaging");

        assertThat(updated.version()).isEqualTo(2L);
        assertThat(updated.isValidDimension("packaging")).isTrue();
        assertThat(updated.metaDimensionFor("packaging")).contains("rater_packaging");
        assertThat(fixture.topics()).contains("config.dimension_added");
    }

    @Test
    void addDimensionRejectsCrossedRoles() {
        assertThatThrownBy(() -> fixture.ledger.addDimension("admin", "rater_quality", "meta_of_meta"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fixture.ledger.addDimension("admin", "packaging", "quality"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fixture.ledger.addDimension("admin", " ", "rater_x"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fixture.ledger.addDimension("bob", "packaging", "rater_packaging"))
                .isInstanceOf(UnauthorizedException.class);
    }
}
