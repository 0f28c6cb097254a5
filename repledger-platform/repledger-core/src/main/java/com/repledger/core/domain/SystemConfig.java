package com.repledger.core.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Singleton record of the tunable economic and statistical parameters.
 * Every mutation produces a new instance with a higher version.
 */
public record SystemConfig(
        BigDecimal minStake,
        BigDecimal disputeCost,
        double slashFraction,
        double decayRate,
        long decayPeriodSeconds,
        double initialAlpha,
        double initialBeta,
        double minRaterWeight,
        double maxRaterWeight,
        Set<String> validDimensions,
        Map<String, String> metaDimensions,
        long version,
        Instant updatedAt
) {

    public SystemConfig {
        SortedSet<String> dims = new TreeSet<>();
        if (validDimensions != null) {
            dims.addAll(validDimensions);
        }
        validDimensions = Collections.unmodifiableSortedSet(dims);
        SortedMap<String, String> metas = new TreeMap<>();
        if (metaDimensions != null) {
            metas.putAll(metaDimensions);
        }
        metaDimensions = Collections.unmodifiableSortedMap(metas);
    }

    public boolean isValidDimension(String dimension) {
        return dimension != null && validDimensions.contains(dimension);
    }

    public Optional<String> metaDimensionFor(String baseDimension) {
        return Optional.ofNullable(metaDimensions.get(baseDimension));
    }

    public boolean isMetaDimension(String dimension) {
        return metaDimensions.containsValue(dimension);
    }

    /**
     * Returns this configuration as the successor of {@code previous}: version bumped, timestamp stamped.
     */
    public SystemConfig succeeding(SystemConfig previous, Instant now) {
        return new SystemConfig(minStake, disputeCost, slashFraction, decayRate, decayPeriodSeconds,
                initialAlpha, initialBeta, minRaterWeight, maxRaterWeight,
                validDimensions, metaDimensions, previous.version() + 1, now);
    }

    public SystemConfig withDimension(String baseDimension, String metaDimension, Instant now) {
        Set<String> dims = new TreeSet<>(validDimensions);
        dims.add(baseDimension);
        Map<String, String> metas = new TreeMap<>(metaDimensions);
        metas.put(baseDimension, metaDimension);
        return new SystemConfig(minStake, disputeCost, slashFraction, decayRate, decayPeriodSeconds,
                initialAlpha, initialBeta, minRaterWeight, maxRaterWeight,
                dims, metas, version + 1, now);
    }
}
