package com.treasurylens.domain;

import java.math.BigInteger;

/**
 * Token balance of one address on one chain.
 */
public record Participant(String address, long chainId, BigInteger balance) {
}
