package com.treasurylens.api.dto;

import com.treasurylens.cache.TreasuryCache;
import com.treasurylens.resilience.GateStats;

import java.util.List;

public record StatsResponse(List<TreasuryCache.CacheStats> caches, List<GateStats> gates) {
}
