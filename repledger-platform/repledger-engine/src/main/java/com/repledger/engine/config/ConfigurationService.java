package com.repledger.engine.config;

import com.repledger.core.domain.SystemConfig;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.identity.AccessPolicy;
import com.repledger.engine.ledger.NotificationTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the singleton {@link SystemConfig} record.
 *
 * <p>The record is created from the documented defaults on first access, mutated only by admins,
 * and every accepted change increments its version. Callers receive the config explicitly and pass
 * it on to the computations that need it.
 */
@Service
public class ConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationService.class);

    private final ReputationEngineProperties properties;
    private final AccessPolicy accessPolicy;

    public ConfigurationService(ReputationEngineProperties properties, AccessPolicy accessPolicy) {
        this.properties = properties;
        this.accessPolicy = accessPolicy;
    }

    // ==================== Read ====================

    /**
     * Returns the stored configuration, seeding it from defaults when absent.
     * The seeded record is written into the transaction and persists if the transaction commits.
     */
    public SystemConfig getConfig(LedgerTransaction tx) {
        return tx.get(LedgerKeys.config(), SystemConfig.class)
                .orElseGet(() -> seedDefaults(tx));
    }

    // ==================== Admin mutations ====================

    public SystemConfig initConfig(LedgerTransaction tx) {
        accessPolicy.requireAdmin(tx.callerId(), "initialize the configuration");
        return tx.get(LedgerKeys.config(), SystemConfig.class).orElseGet(() -> {
            SystemConfig seeded = seedDefaults(tx);
            tx.emit(NotificationTopics.CONFIG_INITIALIZED, Map.of(
                    "version", seeded.version(),
                    "initializedBy", tx.callerId()));
            log.info("System configuration initialized by {}", tx.callerId());
            return seeded;
        });
    }

    public SystemConfig updateConfig(LedgerTransaction tx, SystemConfig proposed) {
        accessPolicy.requireAdmin(tx.callerId(), "update the configuration");
        Objects.requireNonNull(proposed, "Proposed configuration cannot be null");
        List<String> violations = validate(proposed);
        if (!violations.isEmpty()) {
            throw new InvalidInputException(Reason.INVALID_CONFIG, "Invalid configuration: " + String.join("; ", violations));
        }

        SystemConfig current = getConfig(tx);
        SystemConfig next = proposed.succeeding(current, tx.timestamp());
        tx.put(LedgerKeys.config(), next);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousVersion", current.version());
        payload.put("version", next.version());
        payload.put("updatedBy", tx.callerId());
        payload.put("changes", describeChanges(current, next));
        tx.emit(NotificationTopics.CONFIG_UPDATED, payload);

        log.info("Configuration updated to version {} by {}", next.version(), tx.callerId());
        return next;
    }

    public SystemConfig addDimension(LedgerTransaction tx, String baseDimension, String metaDimension) {
        accessPolicy.requireAdmin(tx.callerId(), "add a dimension");
        String base = requireDimensionName(baseDimension, "Base dimension");
        String meta = requireDimensionName(metaDimension, "Meta dimension");
        if (base.equals(meta)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, "Base and meta dimension must differ: " + base);
        }

        SystemConfig current = getConfig(tx);
        if (current.isMetaDimension(base)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, base + " is already a meta dimension");
        }
        if (current.isValidDimension(meta)) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, meta + " is already a ratable dimension");
        }

        SystemConfig next = current.withDimension(base, meta, tx.timestamp());
        tx.put(LedgerKeys.config(), next);
        tx.emit(NotificationTopics.DIMENSION_ADDED, Map.of(
                "dimension", base,
                "metaDimension", meta,
                "version", next.version(),
                "updatedBy", tx.callerId()));

        log.info("Dimension {} (meta {}) added, configuration version {}", base, meta, next.version());
        return next;
    }

    // ==================== Validation ====================

    /**
     * Checks every bound of the configuration record and returns all violations found.
     */
    public static List<String> validate(SystemConfig config) {
        List<String> violations = new ArrayList<>();
        if (config.minStake() == null || config.minStake().signum() < 0) {
            violations.add("minStake must be >= 0");
        }
        if (config.disputeCost() == null || config.disputeCost().signum() < 0) {
            violations.add("disputeCost must be >= 0");
        }
        if (!inUnitInterval(config.slashFraction())) {
            violations.add("slashFraction must be within [0,1]");
        }
        if (!inUnitInterval(config.decayRate())) {
            violations.add("decayRate must be within [0,1]");
        }
        if (config.decayPeriodSeconds() <= 0) {
            violations.add("decayPeriodSeconds must be > 0");
        }
        if (!positiveFinite(config.initialAlpha())) {
            violations.add("initialAlpha must be > 0");
        }
        if (!positiveFinite(config.initialBeta())) {
            violations.add("initialBeta must be > 0");
        }
        if (!Double.isFinite(config.minRaterWeight()) || config.minRaterWeight() < 0) {
            violations.add("minRaterWeight must be >= 0");
        }
        if (!positiveFinite(config.maxRaterWeight())) {
            violations.add("maxRaterWeight must be > 0");
        } else if (config.maxRaterWeight() < config.minRaterWeight()) {
            violations.add("maxRaterWeight must be >= minRaterWeight");
        }
        if (config.validDimensions().isEmpty()) {
            violations.add("at least one valid dimension is required");
        }
        for (Map.Entry<String, String> mapping : config.metaDimensions().entrySet()) {
            String meta = mapping.getValue();
            if (meta == null || meta.isBlank()) {
                violations.add("meta dimension for " + mapping.getKey() + " is blank");
            } else if (config.validDimensions().contains(meta)) {
                violations.add("meta dimension " + meta + " cannot also be a ratable dimension");
            }
        }
        return violations;
    }

    private SystemConfig seedDefaults(LedgerTransaction tx) {
        SystemConfig defaults = properties.getDefaults().toSystemConfig(tx.timestamp());
        List<String> violations = validate(defaults);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Configured defaults are invalid: " + String.join("; ", violations));
        }
        tx.put(LedgerKeys.config(), defaults);
        log.debug("System configuration seeded from defaults (dimensions {})", defaults.validDimensions());
        return defaults;
    }

    private static String requireDimensionName(String raw, String label) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException(Reason.INVALID_DIMENSION, label + " is required");
        }
        return raw.trim();
    }

    private static boolean inUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static boolean positiveFinite(double value) {
        return Double.isFinite(value) && value > 0.0;
    }

    private static String describeChanges(SystemConfig before, SystemConfig after) {
        List<String> changes = new ArrayList<>();
        compare(changes, "minStake", before.minStake(), after.minStake());
        compare(changes, "disputeCost", before.disputeCost(), after.disputeCost());
        compare(changes, "slashFraction", before.slashFraction(), after.slashFraction());
        compare(changes, "decayRate", before.decayRate(), after.decayRate());
        compare(changes, "decayPeriodSeconds", before.decayPeriodSeconds(), after.decayPeriodSeconds());
        compare(changes, "initialAlpha", before.initialAlpha(), after.initialAlpha());
        compare(changes, "initialBeta", before.initialBeta(), after.initialBeta());
        compare(changes, "minRaterWeight", before.minRaterWeight(), after.minRaterWeight());
        compare(changes, "maxRaterWeight", before.maxRaterWeight(), after.maxRaterWeight());
        compare(changes, "validDimensions", before.validDimensions(), after.validDimensions());
        compare(changes, "metaDimensions", before.metaDimensions(), after.metaDimensions());
        return changes.isEmpty() ? "no parameter changes" : String.join(", ", changes);
    }

    private static void compare(List<String> changes, String field, Object before, Object after) {
        boolean same = before instanceof BigDecimal b && after instanceof BigDecimal a
                ? b.compareTo(a) == 0
                : Objects.equals(before, after);
        if (!same) {
            changes.add(field + ": " + before + " -> " + after);
        }
    }
}
