package com.treasurylens.api.dto;

import com.treasurylens.domain.ApprovalStatus;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetMetadata;

/**
 * Ruleset with its metadata word decoded. approvalStatus is set for queued rulesets only.
 */
public record RulesetResponse(long chainId, long projectId, Ruleset ruleset, RulesetMetadata metadata,
                              ApprovalStatus approvalStatus) {
}
