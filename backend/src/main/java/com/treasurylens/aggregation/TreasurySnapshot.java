package com.treasurylens.aggregation;

import com.treasurylens.chain.ContractBundle;
import com.treasurylens.domain.Currency;
import com.treasurylens.domain.GroupParticipant;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetMetadata;
import com.treasurylens.treasury.IssuanceCalculator;
import com.treasurylens.treasury.PayoutCalculator;

import java.math.BigInteger;
import java.util.List;

/**
 * Reconciled view of a project across its sucker group. Nullable fields were unavailable; their slot names are
 * listed in degradedSlots.
 */
public record TreasurySnapshot(
        long projectId,
        long chainId,
        int version,
        ContractBundle contracts,
        String handle,
        String suckerGroupId,
        Currency currency,
        int decimals,
        String tokenSymbol,
        GroupTotals totals,
        List<ChainTreasury> chains,
        List<Long> connectedChains,
        List<String> suckers,
        List<GroupParticipant> participants,
        Ruleset currentRuleset,
        RulesetMetadata metadata,
        BigInteger floorPricePerToken,
        BigInteger payerIssuance,
        IssuanceCalculator.IssuanceRate observedIssuance,
        PayoutCalculator.Payout payout,
        List<String> degradedSlots
) {

    public boolean isDegraded() {
        return !degradedSlots.isEmpty() || chains.stream().anyMatch(ChainTreasury::degraded);
    }
}
