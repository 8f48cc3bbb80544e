package com.treasurylens.domain;

import java.math.BigInteger;

/**
 * Tokens cashed out by a holder: cashOutCount tokens burned for reclaimAmount of the accounting token.
 */
public record CashOutEvent(String holder, BigInteger cashOutCount, BigInteger reclaimAmount, long timestamp) {
}
