package com.treasurylens.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Holder merged across a sucker group: summed balance, each chain listed once, share of the group's token supply.
 */
public record GroupParticipant(String address, BigInteger balance, List<Long> chains, BigDecimal percent) {
}
