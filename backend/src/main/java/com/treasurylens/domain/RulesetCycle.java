package com.treasurylens.domain;

import java.math.BigInteger;

/**
 * One expanded cycle of a project's ruleset timeline. rulesetId is the base configuration in effect.
 */
public record RulesetCycle(
        long cycleNumber,
        long rulesetId,
        long start,
        long duration,
        BigInteger weight,
        long weightCutPercent,
        BigInteger metadata,
        CycleStatus status
) {
}
