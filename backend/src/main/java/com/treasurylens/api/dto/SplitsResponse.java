package com.treasurylens.api.dto;

import com.treasurylens.domain.Split;

import java.util.List;

/**
 * Split groups of one ruleset. Remainders are what the project owner receives, out of 1,000,000,000.
 */
public record SplitsResponse(long chainId, long projectId, long rulesetId,
                             List<Split> payoutSplits, long payoutOwnerRemainder,
                             List<Split> reservedSplits, long reservedOwnerRemainder) {
}
