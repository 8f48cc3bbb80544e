package com.treasurylens.domain;

import java.util.List;

/**
 * Payout limits and surplus allowances of one ruleset for one terminal/token.
 */
public record FundAccessLimits(List<CurrencyAmount> payoutLimits, List<CurrencyAmount> surplusAllowances) {

    public FundAccessLimits {
        payoutLimits = payoutLimits != null ? List.copyOf(payoutLimits) : List.of();
        surplusAllowances = surplusAllowances != null ? List.copyOf(surplusAllowances) : List.of();
    }

    public static FundAccessLimits none() {
        return new FundAccessLimits(List.of(), List.of());
    }
}
