package com.treasurylens.domain;

import java.math.BigInteger;
import java.util.List;

/**
 * Projects on several chains bridged into one logical treasury. Totals are the indexer's pre-aggregated values
 * and may be null when the indexer did not report them.
 */
public record SuckerGroup(
        String id,
        BigInteger balance,
        BigInteger volume,
        BigInteger tokenSupply,
        Long paymentsCount,
        List<Project> projects
) {

    public SuckerGroup {
        projects = projects != null ? List.copyOf(projects) : List.of();
    }

    public boolean hasAggregates() {
        return balance != null && volume != null && paymentsCount != null;
    }
}
