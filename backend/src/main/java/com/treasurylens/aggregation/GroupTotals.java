package com.treasurylens.aggregation;

import com.treasurylens.domain.Project;
import com.treasurylens.domain.SuckerGroup;

import java.math.BigInteger;
import java.util.List;

/**
 * Balance, volume, payment count and token supply of a whole sucker group, with where they came from.
 */
public record GroupTotals(
        BigInteger balance,
        BigInteger volume,
        long paymentsCount,
        BigInteger tokenSupply,
        Source source
) {

    public enum Source {
        /** Indexer's pre-aggregated group values. */
        GROUP_AGGREGATE,
        /** Sum over the group's member projects. */
        MEMBER_SUM,
        /** Project without a group: its own values. */
        SINGLETON,
        /** Indexer unavailable: sum of on-chain reads. */
        ON_CHAIN
    }

    /**
     * Group aggregates win; a group without them is summed over its members; no group means the seed project alone.
     * Without any indexer data the non-degraded chain reads are summed.
     */
    public static GroupTotals of(Project seed, SuckerGroup group, List<ChainTreasury> chains) {
        if (group != null && group.hasAggregates()) {
            BigInteger supply = group.tokenSupply() != null ? group.tokenSupply() : sumSupply(group.projects());
            return new GroupTotals(group.balance(), group.volume(), group.paymentsCount(), supply, Source.GROUP_AGGREGATE);
        }
        if (group != null && !group.projects().isEmpty()) {
            BigInteger balance = BigInteger.ZERO;
            BigInteger volume = BigInteger.ZERO;
            long payments = 0L;
            for (Project member : group.projects()) {
                balance = balance.add(member.balance());
                volume = volume.add(member.volume());
                payments += member.paymentsCount();
            }
            return new GroupTotals(balance, volume, payments, sumSupply(group.projects()), Source.MEMBER_SUM);
        }
        if (seed != null) {
            return new GroupTotals(seed.balance(), seed.volume(), seed.paymentsCount(), seed.tokenSupply(), Source.SINGLETON);
        }
        BigInteger balance = BigInteger.ZERO;
        BigInteger supply = BigInteger.ZERO;
        for (ChainTreasury chain : chains) {
            if (!chain.degraded()) {
                balance = balance.add(chain.balance());
                supply = supply.add(chain.tokenSupply());
            }
        }
        return new GroupTotals(balance, BigInteger.ZERO, 0L, supply, Source.ON_CHAIN);
    }

    private static BigInteger sumSupply(List<Project> projects) {
        return projects.stream().map(Project::tokenSupply).reduce(BigInteger.ZERO, BigInteger::add);
    }
}
