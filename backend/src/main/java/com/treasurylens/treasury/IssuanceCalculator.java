package com.treasurylens.treasury;

import com.treasurylens.domain.PayEvent;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Token issuance per unit paid. The configured rate comes from the ruleset weight; the observed rate from
 * recent pay events, which also reflects data hooks that alter issuance.
 */
public final class IssuanceCalculator {

    private static final int SCALE = 18;
    private static final BigInteger BP = BigInteger.valueOf(10_000);

    private IssuanceCalculator() {
    }

    /**
     * Tokens the payer receives per unit of base currency: weight minus the reserved share. 18-decimal fixed point.
     */
    public static BigInteger payerIssuance(BigInteger weight, int reservedPercent) {
        if (weight == null || weight.signum() <= 0) {
            return BigInteger.ZERO;
        }
        int reserved = Math.max(0, Math.min(reservedPercent, 10_000));
        return weight.multiply(BP.subtract(BigInteger.valueOf(reserved))).divide(BP);
    }

    /**
     * Tokens issued per unit paid over the given events (total issued / total paid). Empty when nothing was paid.
     */
    public static Optional<IssuanceRate> observedRate(List<PayEvent> events) {
        if (events == null || events.isEmpty()) {
            return Optional.empty();
        }
        BigInteger totalTokens = BigInteger.ZERO;
        BigInteger totalAmount = BigInteger.ZERO;
        for (PayEvent event : events) {
            totalTokens = totalTokens.add(event.newlyIssuedTokenCount() != null ? event.newlyIssuedTokenCount() : BigInteger.ZERO);
            totalAmount = totalAmount.add(event.amount() != null ? event.amount() : BigInteger.ZERO);
        }
        if (totalAmount.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal tokensPerUnit = new BigDecimal(totalTokens).divide(new BigDecimal(totalAmount), SCALE, RoundingMode.HALF_UP);
        return Optional.of(new IssuanceRate(tokensPerUnit, events.size()));
    }

    public record IssuanceRate(BigDecimal tokensPerUnit, int basedOnPayments) {
    }
}
