package com.repledger.engine.config;

import com.repledger.core.domain.SystemConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings bound from {@code repledger.*}.
 *
 * <p>{@code defaults} seeds the on-ledger {@link SystemConfig} the first time it is read; after
 * that the stored record is authoritative and only changes through admin updates.
 */
@Configuration(proxyBeanMethods = false)
@ConfigurationProperties(prefix = "repledger")
@Validated
public class ReputationEngineProperties {

    @Valid
    private Defaults defaults = new Defaults();
    @Valid
    private Security security = new Security();
    @Valid
    private Rating rating = new Rating();
    @Valid
    private Metrics metrics = new Metrics();
    private Store store = new Store();

    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }
    public Security getSecurity() { return security; }
    public void setSecurity(Security security) { this.security = security; }
    public Rating getRating() { return rating; }
    public void setRating(Rating rating) { this.rating = rating; }
    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    /**
     * Documented defaults for the system configuration record.
     */
    public static class Defaults {

        @NotNull
        @PositiveOrZero
        private BigDecimal minStake = new BigDecimal("1000");
        @NotNull
        @PositiveOrZero
        private BigDecimal disputeCost = new BigDecimal("100");
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double slashFraction = 0.30;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double decayRate = 0.98;
        @Positive
        private long decayPeriodSeconds = 86_400L; // 1 day
        @Positive
        private double initialAlpha = 1.0;
        @Positive
        private double initialBeta = 1.0;
        @PositiveOrZero
        private double minRaterWeight = 0.1;
        @Positive
        private double maxRaterWeight = 5.0;
        /** Base dimension to its rater meta dimension; the built-in set lives in application.yml. */
        @NotEmpty
        private Map<String, String> dimensions = new LinkedHashMap<>();

        public SystemConfig toSystemConfig(Instant now) {
            return new SystemConfig(minStake, disputeCost, slashFraction, decayRate, decayPeriodSeconds,
                    initialAlpha, initialBeta, minRaterWeight, maxRaterWeight,
                    dimensions.keySet(), dimensions, 1L, now);
        }

        public BigDecimal getMinStake() { return minStake; }
        public void setMinStake(BigDecimal minStake) { this.minStake = minStake; }
        public BigDecimal getDisputeCost() { return disputeCost; }
        public void setDisputeCost(BigDecimal disputeCost) { this.disputeCost = disputeCost; }
        public double getSlashFraction() { return slashFraction; }
        public void setSlashFraction(double slashFraction) { this.slashFraction = slashFraction; }
        public double getDecayRate() { return decayRate; }
        public void setDecayRate(double decayRate) { this.decayRate = decayRate; }
        public long getDecayPeriodSeconds() { return decayPeriodSeconds; }
        public void setDecayPeriodSeconds(long seconds) { this.decayPeriodSeconds = seconds; }
        public double getInitialAlpha() { return initialAlpha; }
        public void setInitialAlpha(double initialAlpha) { this.initialAlpha = initialAlpha; }
        public double getInitialBeta() { return initialBeta; }
        public void setInitialBeta(double initialBeta) { this.initialBeta = initialBeta; }
        public double getMinRaterWeight() { return minRaterWeight; }
        public void setMinRaterWeight(double weight) { this.minRaterWeight = weight; }
        public double getMaxRaterWeight() { return maxRaterWeight; }
        public void setMaxRaterWeight(double weight) { this.maxRaterWeight = weight; }
        public Map<String, String> getDimensions() { return dimensions; }
        public void setDimensions(Map<String, String> dimensions) { this.dimensions = dimensions; }
    }

    /**
     * Role holders, listed as raw credentials; they are normalized before comparison.
     */
    public static class Security {

        @NotEmpty
        private List<String> admins = new ArrayList<>(List.of("admin"));
        private List<String> arbitrators = new ArrayList<>(List.of("arbitrator"));

        public List<String> getAdmins() { return admins; }
        public void setAdmins(List<String> admins) { this.admins = admins; }
        public List<String> getArbitrators() { return arbitrators; }
        public void setArbitrators(List<String> arbitrators) { this.arbitrators = arbitrators; }
    }

    public static class Rating {

        @NotNull
        private Duration maxClockSkew = Duration.ofMinutes(5);

        public Duration getMaxClockSkew() { return maxClockSkew; }
        public void setMaxClockSkew(Duration maxClockSkew) { this.maxClockSkew = maxClockSkew; }
    }

    public static class Metrics {

        @Min(1)
        private int maxAttempts = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Store {

        /** {@code memory} (default) or {@code jpa}. */
        private String type = "memory";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }
}
