package com.treasurylens.domain;

/**
 * Fields shared by every activity event. decimals/currency describe the project's accounting token.
 */
public record EventContext(
        String id,
        long chainId,
        long projectId,
        long timestamp,
        String from,
        String txHash,
        String projectName,
        String projectHandle,
        Integer decimals,
        Integer currency
) {

    public Currency accountingCurrency() {
        return Currency.infer(decimals, currency);
    }
}
