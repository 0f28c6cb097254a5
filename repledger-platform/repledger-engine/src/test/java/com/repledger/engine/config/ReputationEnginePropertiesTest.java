package com.repledger.engine.config;

import com.repledger.core.domain.SystemConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ReputationEnginePropertiesTest {

    private static ReputationEngineProperties bind(Map<String, String> source) {
        return new Binder(new MapConfigurationPropertySource(source))
                .bind("repledger", ReputationEngineProperties.class)
                .get();
    }

    @Test
    void boundDimensionsReplaceRatherThanExtend() {
        ReputationEngineProperties properties = bind(Map.of(
                "repledger.defaults.dimensions.speed", "rater_speed",
                "repledger.defaults.dimensions.accuracy", "rater_accuracy"));

        SystemConfig config = properties.getDefaults().toSystemConfig(Instant.parse("2026-03-01T10:00:00Z"));

        assertThat(properties.getDefaults().getDimensions())
                .containsOnlyKeys("speed", "accuracy");
        assertThat(config.validDimensions()).containsExactlyInAnyOrder("speed", "accuracy");
        assertThat(config.metaDimensionFor("speed")).contains("rater_speed");
    }

    @Test
    void scalarDefaultsSurviveWhenOnlyDimensionsAreBound() {
        ReputationEngineProperties properties = bind(Map.of(
                "repledger.defaults.dimensions.quality", "rater_quality"));

        assertThat(properties.getDefaults().getMinStake()).isEqualByComparingTo("1000");
        assertThat(properties.getDefaults().getSlashFraction()).isEqualTo(0.30);
        assertThat(properties.getSecurity().getAdmins()).containsExactly("admin");
    }
}
