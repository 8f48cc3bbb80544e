package com.treasurylens.domain;

/**
 * Recipient allocation in a payout or reserved-token split group. percent is out of 1,000,000,000.
 * Either projectId (non-zero) or beneficiary receives funds; a non-zero hook receives a callback instead.
 */
public record Split(
        long percent,
        long projectId,
        String beneficiary,
        boolean preferAddToBalance,
        long lockedUntil,
        String hook
) {

    public static final long SPLITS_TOTAL_PERCENT = 1_000_000_000L;

    public boolean isLocked(long nowEpochSeconds) {
        return lockedUntil > nowEpochSeconds;
    }
}
