package com.treasurylens.api.dto;

import com.treasurylens.domain.RulesetCycle;

import java.util.List;

public record HistoryResponse(long chainId, long projectId, List<RulesetCycle> cycles) {
}
