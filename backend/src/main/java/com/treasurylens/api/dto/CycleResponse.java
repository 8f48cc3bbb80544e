package com.treasurylens.api.dto;

public record CycleResponse(long chainId, long projectId, long cycleNumber) {
}
