package com.treasurylens.resilience;

import java.time.Duration;

public record GateStats(String name, String state, int failedCalls, int bufferedCalls, Duration retryAfter) {
}
