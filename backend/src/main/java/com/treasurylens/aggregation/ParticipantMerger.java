package com.treasurylens.aggregation;

import com.treasurylens.common.Addresses;
import com.treasurylens.domain.GroupParticipant;
import com.treasurylens.domain.Participant;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-chain holder rows into one row per address: balances summed, chains listed once in first-seen order,
 * percent of the group's total supply (0 when the supply is unknown or zero). Result is sorted by balance, largest first.
 */
public final class ParticipantMerger {

    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ParticipantMerger() {
    }

    public static List<GroupParticipant> merge(List<Participant> rows, BigInteger totalSupply) {
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        Map<String, Set<Long>> chains = new LinkedHashMap<>();
        for (Participant row : rows) {
            if (row.address() == null) {
                continue;
            }
            String address = Addresses.normalize(row.address());
            balances.merge(address, row.balance() != null ? row.balance() : BigInteger.ZERO, BigInteger::add);
            chains.computeIfAbsent(address, a -> new LinkedHashSet<>()).add(row.chainId());
        }
        List<GroupParticipant> merged = new ArrayList<>(balances.size());
        balances.forEach((address, balance) -> merged.add(
                new GroupParticipant(address, balance, List.copyOf(chains.get(address)), percentOf(balance, totalSupply))));
        merged.sort(Comparator.comparing(GroupParticipant::balance).reversed());
        return merged;
    }

    static BigDecimal percentOf(BigInteger balance, BigInteger totalSupply) {
        if (totalSupply == null || totalSupply.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(balance).multiply(HUNDRED).divide(new BigDecimal(totalSupply), PERCENT_SCALE, RoundingMode.HALF_UP);
    }
}
