package com.treasurylens.cache;

import com.treasurylens.domain.FundAccessLimits;
import com.treasurylens.domain.QueuedRuleset;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetCycle;
import com.treasurylens.domain.SplitGroups;

import java.time.Duration;
import java.util.List;

/**
 * Named caches of the data layer, keyed by chain and project (see {@link #key}).
 * History is permanent: past cycles never change once the current cycle number is known.
 */
public class TreasuryCaches {

    public static final String CURRENT_RULESET = "currentRuleset";
    public static final String QUEUED_RULESET = "queuedRuleset";
    public static final String SPLITS = "splits";
    public static final String FUND_ACCESS_LIMITS = "fundAccessLimits";
    public static final String RULESET_HISTORY = "rulesetHistory";
    public static final String CYCLE_NUMBER = "cycleNumber";

    private final TreasuryCache<String, Ruleset> currentRulesets;
    private final TreasuryCache<String, QueuedRuleset> queuedRulesets;
    private final TreasuryCache<String, SplitGroups> splits;
    private final TreasuryCache<String, FundAccessLimits> fundAccessLimits;
    private final TreasuryCache<String, List<RulesetCycle>> history;
    private final TreasuryCache<String, Long> cycleNumbers;

    public TreasuryCaches(Duration rulesetTtl, Duration splitsTtl, long maxSize) {
        this.currentRulesets = TreasuryCache.withTtl(CURRENT_RULESET, rulesetTtl, maxSize);
        this.queuedRulesets = TreasuryCache.withTtl(QUEUED_RULESET, rulesetTtl, maxSize);
        this.splits = TreasuryCache.withTtl(SPLITS, splitsTtl, maxSize);
        this.fundAccessLimits = TreasuryCache.withTtl(FUND_ACCESS_LIMITS, splitsTtl, maxSize);
        this.history = TreasuryCache.permanent(RULESET_HISTORY, maxSize);
        this.cycleNumbers = TreasuryCache.permanent(CYCLE_NUMBER, maxSize);
    }

    public static String key(long chainId, long projectId) {
        return chainId + ":" + projectId;
    }

    public static String key(long chainId, long projectId, long rulesetId) {
        return chainId + ":" + projectId + ":" + rulesetId;
    }

    public TreasuryCache<String, Ruleset> currentRulesets() {
        return currentRulesets;
    }

    public TreasuryCache<String, QueuedRuleset> queuedRulesets() {
        return queuedRulesets;
    }

    public TreasuryCache<String, SplitGroups> splits() {
        return splits;
    }

    public TreasuryCache<String, FundAccessLimits> fundAccessLimits() {
        return fundAccessLimits;
    }

    public TreasuryCache<String, List<RulesetCycle>> history() {
        return history;
    }

    /** Last cycle number observed per chain:project, used to detect cycle changes. */
    public TreasuryCache<String, Long> cycleNumbers() {
        return cycleNumbers;
    }

    public List<TreasuryCache.CacheStats> stats() {
        return List.of(currentRulesets.stats(), queuedRulesets.stats(), splits.stats(),
                fundAccessLimits.stats(), history.stats(), cycleNumbers.stats());
    }

    public void clearAll() {
        currentRulesets.clear();
        queuedRulesets.clear();
        splits.clear();
        fundAccessLimits.clear();
        history.clear();
        cycleNumbers.clear();
    }
}
