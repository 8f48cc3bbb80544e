package com.treasurylens.domain;

import java.math.BigInteger;

public record PayEvent(BigInteger amount, BigInteger newlyIssuedTokenCount, long timestamp) {
}
