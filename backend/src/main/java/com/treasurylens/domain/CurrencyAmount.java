package com.treasurylens.domain;

import java.math.BigInteger;

public record CurrencyAmount(BigInteger amount, long currency) {
}
