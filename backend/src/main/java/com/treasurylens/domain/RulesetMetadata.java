package com.treasurylens.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decoded ruleset metadata word. reservedPercent and cashOutTaxRate are basis points of 10000.
 */
public record RulesetMetadata(
        int reservedPercent,
        int cashOutTaxRate,
        long baseCurrency,
        boolean pausePay,
        boolean pauseCashOut,
        boolean pauseCreditTransfers,
        boolean allowOwnerMinting,
        boolean allowSetCustomToken,
        boolean allowTerminalMigration,
        boolean allowSetTerminals,
        boolean allowSetController,
        boolean allowAddAccountingContext,
        boolean allowAddPriceFeed,
        boolean ownerMustSendPayouts,
        boolean holdFees,
        boolean useTotalSurplusForCashOuts,
        boolean useDataHookForPay,
        boolean useDataHookForCashOut,
        String dataHook,
        int metadata
) {

    public static final int MAX_BASIS_POINTS = 10_000;

    public BigDecimal reservedFraction() {
        return BigDecimal.valueOf(reservedPercent).divide(BigDecimal.valueOf(MAX_BASIS_POINTS), 4, RoundingMode.UNNECESSARY);
    }

    public BigDecimal cashOutTaxFraction() {
        return BigDecimal.valueOf(cashOutTaxRate).divide(BigDecimal.valueOf(MAX_BASIS_POINTS), 4, RoundingMode.UNNECESSARY);
    }
}
