package com.repledger.engine.stake;

import com.repledger.core.domain.Stake;
import com.repledger.core.error.InsufficientStakeException;
import com.repledger.core.error.InvalidInputException;
import com.repledger.core.error.InvalidInputException.Reason;
import com.repledger.core.ledger.LedgerKeys;
import com.repledger.core.ledger.LedgerTransaction;
import com.repledger.engine.ledger.NotificationTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stake ledger: deposits, dispute-cost locks and slashing.
 * Balances are decimal money and never go negative.
 */
@Service
public class StakeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StakeLedgerService.class);

    /** Scale for slashed amounts. */
    static final int MONEY_SCALE = 8;

    public Stake getOrInit(LedgerTransaction tx, String actorId) {
        return tx.get(LedgerKeys.stake(actorId), Stake.class)
                .orElseGet(() -> Stake.empty(actorId, tx.timestamp()));
    }

    // ==================== Deposits ====================

    public Stake deposit(LedgerTransaction tx, String actorId, double amount) {
        if (!Double.isFinite(amount) || amount <= 0) {
            throw new InvalidInputException(Reason.INVALID_AMOUNT, "Deposit amount must be positive and finite: " + amount);
        }
        return deposit(tx, actorId, BigDecimal.valueOf(amount));
    }

    public Stake deposit(LedgerTransaction tx, String actorId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException(Reason.INVALID_AMOUNT, "Deposit amount must be positive: " + amount);
        }
        Stake updated = getOrInit(tx, actorId).deposit(amount, tx.timestamp());
        tx.put(LedgerKeys.stake(actorId), updated);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actorId", actorId);
        payload.put("amount", amount.toPlainString());
        payload.put("available", updated.available().toPlainString());
        tx.emit(NotificationTopics.STAKE_DEPOSITED, payload);

        log.debug("Deposited {} for {}, available now {}", amount, actorId, updated.available());
        return updated;
    }

    // ==================== Dispute locks ====================

    public void requireAvailable(LedgerTransaction tx, String actorId, BigDecimal required) {
        Stake stake = getOrInit(tx, actorId);
        if (!stake.covers(required)) {
            throw new InsufficientStakeException(actorId, required, stake.available());
        }
    }

    public Stake lockForDispute(LedgerTransaction tx, String actorId, BigDecimal cost) {
        Stake stake = getOrInit(tx, actorId);
        if (!stake.covers(cost)) {
            throw new InsufficientStakeException(actorId, cost, stake.available());
        }
        Stake locked = stake.lock(cost, tx.timestamp());
        tx.put(LedgerKeys.stake(actorId), locked);
        return locked;
    }

    /**
     * Returns a previously locked dispute cost to the available balance.
     */
    public Stake releaseLock(LedgerTransaction tx, String actorId, BigDecimal cost) {
        Stake stake = getOrInit(tx, actorId);
        // a lock can only shrink through this path; clamp in case the record was edited out of band
        BigDecimal releasable = cost.min(stake.locked());
        if (releasable.compareTo(cost) < 0) {
            log.warn("Stake of {} holds {} locked, less than the {} being released", actorId, stake.locked(), cost);
        }
        Stake released = stake.release(releasable, tx.timestamp());
        tx.put(LedgerKeys.stake(actorId), released);
        return released;
    }

    // ==================== Slashing ====================

    public SlashResult slash(LedgerTransaction tx, String actorId, double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new InvalidInputException(Reason.INVALID_CONFIG, "Slash fraction must be within [0,1]: " + fraction);
        }
        Stake stake = getOrInit(tx, actorId);
        BigDecimal slashed = stake.available()
                .multiply(BigDecimal.valueOf(fraction))
                .setScale(MONEY_SCALE, RoundingMode.DOWN)
                .stripTrailingZeros();
        if (slashed.signum() == 0) {
            slashed = BigDecimal.ZERO;
        }
        Stake after = stake.slash(slashed, tx.timestamp());
        tx.put(LedgerKeys.stake(actorId), after);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actorId", actorId);
        payload.put("slashed", slashed.toPlainString());
        payload.put("remaining", after.available().toPlainString());
        tx.emit(NotificationTopics.STAKE_SLASHED, payload);

        log.info("Slashed {} from {} ({} of available), {} remaining", slashed, actorId, fraction, after.available());
        return new SlashResult(actorId, slashed, after);
    }

    public record SlashResult(String actorId, BigDecimal slashed, Stake stake) {}
}
