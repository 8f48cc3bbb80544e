package com.treasurylens.domain;

import java.math.BigInteger;

/**
 * On-chain ruleset as returned by JBRulesets. metadata is the raw packed word.
 * weightCutPercent is in parts per billion; duration 0 means the ruleset never advances by time.
 */
public record Ruleset(
        long cycleNumber,
        long id,
        long basedOnId,
        long start,
        long duration,
        BigInteger weight,
        long weightCutPercent,
        String approvalHook,
        BigInteger metadata
) {

    public static final long MAX_WEIGHT_CUT_PERCENT = 1_000_000_000L;

    /**
     * The rulesets contract answers with an all-zero struct when a project has no ruleset.
     */
    public boolean exists() {
        return id != 0L;
    }
}
