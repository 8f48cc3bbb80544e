package com.treasurylens.treasury;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Bonding-curve cash-out value. For a redeemed fraction {@code x = tokens / supply} and tax rate
 * {@code r = taxRateBp / 10000} the reclaimable share of the treasury is {@code y = x * ((1 - r) + r * x)}.
 * r = 0 is linear redemption, r = 1 gives {@code y = x^2}. Amounts are computed exactly and rounded down.
 */
public final class FloorPriceCalculator {

    public static final int MAX_TAX_RATE = 10_000;
    public static final BigInteger ONE_TOKEN = BigInteger.TEN.pow(18);

    private static final int SCALE = 18;
    private static final BigInteger BP = BigInteger.valueOf(MAX_TAX_RATE);

    private FloorPriceCalculator() {
    }

    /**
     * Treasury amount returned for redeeming {@code tokensToRedeem} out of {@code totalSupply}.
     * Zero when supply, balance or tokens are zero; tokens above supply are capped at supply.
     */
    public static BigInteger cashOutValue(BigInteger balance, BigInteger totalSupply, int taxRateBp, BigInteger tokensToRedeem) {
        requireTaxRate(taxRateBp);
        if (isNotPositive(totalSupply) || isNotPositive(balance) || isNotPositive(tokensToRedeem)) {
            return BigInteger.ZERO;
        }
        BigInteger tokens = tokensToRedeem.min(totalSupply);
        BigInteger r = BigInteger.valueOf(taxRateBp);
        // balance * t * ((BP - r) * s + r * t) / (s^2 * BP)
        BigInteger numerator = balance.multiply(tokens)
                .multiply(BP.subtract(r).multiply(totalSupply).add(r.multiply(tokens)));
        BigInteger denominator = totalSupply.multiply(totalSupply).multiply(BP);
        return numerator.divide(denominator);
    }

    /**
     * Value of redeeming one whole 18-decimal token (or the whole supply, if smaller).
     */
    public static BigInteger floorPricePerToken(BigInteger balance, BigInteger totalSupply, int taxRateBp) {
        if (isNotPositive(totalSupply)) {
            return BigInteger.ZERO;
        }
        return cashOutValue(balance, totalSupply, taxRateBp, ONE_TOKEN.min(totalSupply));
    }

    /**
     * Curve value y for a redeemed fraction x in [0, 1].
     */
    public static BigDecimal curve(BigDecimal x, int taxRateBp) {
        requireTaxRate(taxRateBp);
        if (x == null || x.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal fraction = x.min(BigDecimal.ONE);
        BigDecimal r = BigDecimal.valueOf(taxRateBp).divide(BigDecimal.valueOf(MAX_TAX_RATE), 4, RoundingMode.UNNECESSARY);
        return fraction.multiply(BigDecimal.ONE.subtract(r).add(r.multiply(fraction)))
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static void requireTaxRate(int taxRateBp) {
        if (taxRateBp < 0 || taxRateBp > MAX_TAX_RATE) {
            throw new IllegalArgumentException("cashOutTaxRate out of range [0, 10000]: " + taxRateBp);
        }
    }

    private static boolean isNotPositive(BigInteger value) {
        return value == null || value.signum() <= 0;
    }
}
