package com.treasurylens.treasury;

import java.math.BigInteger;

/**
 * Distributable payout under a ruleset's payout limit. Three cases, never collapsed into one clamp:
 * a zero limit disables payouts, the max-uint sentinel means unlimited (the terminal balance is available),
 * anything else leaves {@code limit - used}, floored at zero.
 */
public final class PayoutCalculator {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    /** Payout limits are stored as uint224 on-chain; its max is the same sentinel at struct width. */
    public static final BigInteger MAX_UINT224 = BigInteger.ONE.shiftLeft(224).subtract(BigInteger.ONE);

    private PayoutCalculator() {
    }

    public static BigInteger available(BigInteger limit, BigInteger used, BigInteger terminalBalance) {
        return evaluate(limit, used, terminalBalance).available();
    }

    public static Payout evaluate(BigInteger limit, BigInteger used, BigInteger terminalBalance) {
        BigInteger l = limit != null ? limit : BigInteger.ZERO;
        BigInteger u = used != null ? used : BigInteger.ZERO;
        if (l.signum() == 0) {
            return new Payout(Kind.DISABLED, l, u, BigInteger.ZERO);
        }
        if (isUnlimited(l)) {
            BigInteger balance = terminalBalance != null ? terminalBalance.max(BigInteger.ZERO) : BigInteger.ZERO;
            return new Payout(Kind.UNLIMITED, l, u, balance);
        }
        return new Payout(Kind.LIMITED, l, u, l.subtract(u).max(BigInteger.ZERO));
    }

    /**
     * Exact sentinel comparison only; large but finite limits are limits.
     */
    public static boolean isUnlimited(BigInteger limit) {
        return MAX_UINT256.equals(limit) || MAX_UINT224.equals(limit);
    }

    public enum Kind {
        DISABLED,
        UNLIMITED,
        LIMITED
    }

    public record Payout(Kind kind, BigInteger limit, BigInteger used, BigInteger available) {
    }
}
