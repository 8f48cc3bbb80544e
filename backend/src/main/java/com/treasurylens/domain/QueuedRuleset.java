package com.treasurylens.domain;

public record QueuedRuleset(Ruleset ruleset, ApprovalStatus approvalStatus) {
}
