package com.treasurylens.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * One protocol deployment on one chain as reported by the indexer. (projectId, chainId, version) is unique.
 * Amounts are integers in the smallest unit of the project's accounting token.
 */
public record Project(
        long projectId,
        long chainId,
        int version,
        String handle,
        String owner,
        String metadataUri,
        BigInteger balance,
        BigInteger volume,
        BigDecimal volumeUsd,
        long paymentsCount,
        Integer decimals,
        Integer currency,
        String token,
        String tokenSymbol,
        BigInteger tokenSupply,
        String suckerGroupId,
        Instant createdAt
) {

    public Project {
        balance = balance != null ? balance : BigInteger.ZERO;
        volume = volume != null ? volume : BigInteger.ZERO;
        tokenSupply = tokenSupply != null ? tokenSupply : BigInteger.ZERO;
    }

    public boolean hasSuckerGroup() {
        return suckerGroupId != null && !suckerGroupId.isBlank();
    }

    public Currency accountingCurrency() {
        return Currency.infer(decimals, currency);
    }

    public int accountingDecimals() {
        return decimals != null ? decimals : accountingCurrency().getDefaultDecimals();
    }
}
