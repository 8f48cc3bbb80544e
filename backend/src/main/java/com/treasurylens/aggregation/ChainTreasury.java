package com.treasurylens.aggregation;

import java.math.BigInteger;

/**
 * On-chain treasury state of one group member. A degraded entry is zeroed because its reads failed.
 */
public record ChainTreasury(
        long chainId,
        long projectId,
        BigInteger balance,
        BigInteger payoutLimit,
        BigInteger usedPayout,
        BigInteger tokenSupply,
        boolean degraded
) {

    public static ChainTreasury degraded(long chainId, long projectId) {
        return new ChainTreasury(chainId, projectId, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, true);
    }
}
