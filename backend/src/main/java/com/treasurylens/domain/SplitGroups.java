package com.treasurylens.domain;

import java.util.List;

/**
 * Payout and reserved-token splits for one ruleset. Each group's percents sum to at most 100%;
 * the remainder goes to the project owner.
 */
public record SplitGroups(List<Split> payoutSplits, List<Split> reservedSplits) {

    public SplitGroups {
        payoutSplits = payoutSplits != null ? List.copyOf(payoutSplits) : List.of();
        reservedSplits = reservedSplits != null ? List.copyOf(reservedSplits) : List.of();
    }

    public static long ownerRemainder(List<Split> splits) {
        long allocated = splits.stream().mapToLong(Split::percent).sum();
        return Math.max(0L, Split.SPLITS_TOTAL_PERCENT - allocated);
    }
}
