package com.repledger.core.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Staked capital of one actor, split into available and locked balances.
 */
public record Stake(
        String actorId,
        BigDecimal available,
        BigDecimal locked,
        Instant lastUpdated
) {

    public static Stake empty(String actorId, Instant now) {
        return new Stake(actorId, BigDecimal.ZERO, BigDecimal.ZERO, now);
    }

    public BigDecimal total() {
        return available.add(locked);
    }

    public boolean covers(BigDecimal required) {
        return available.compareTo(required) >= 0;
    }

    public Stake deposit(BigDecimal amount, Instant now) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        return new Stake(actorId, available.add(amount), locked, now);
    }

    public Stake lock(BigDecimal amount, Instant now) {
        if (amount.compareTo(available) > 0) {
            throw new IllegalStateException("Insufficient available stake to lock");
        }
        return new Stake(actorId, available.subtract(amount), locked.add(amount), now);
    }

    public Stake release(BigDecimal amount, Instant now) {
        if (amount.compareTo(locked) > 0) {
            throw new IllegalStateException("Cannot release more than locked");
        }
        return new Stake(actorId, available.add(amount), locked.subtract(amount), now);
    }

    /**
     * Removes {@code amount} from the available balance, never going below zero.
     */
    public Stake slash(BigDecimal amount, Instant now) {
        BigDecimal remaining = available.subtract(amount).max(BigDecimal.ZERO);
        return new Stake(actorId, remaining, locked, now);
    }
}
