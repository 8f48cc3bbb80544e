package com.treasurylens.resilience;

import java.time.Duration;

/**
 * Breaker tuning: consecutive failures to open, first cooldown, growth factor per failed trial, cooldown cap.
 */
public record GateSettings(int failureThreshold, Duration cooldown, double backoffMultiplier, Duration maxCooldown) {

    public GateSettings {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (maxCooldown == null || maxCooldown.compareTo(cooldown) < 0) {
            maxCooldown = cooldown;
        }
    }

    public static GateSettings indexerDefaults() {
        return new GateSettings(3, Duration.ofSeconds(120), 2.0, Duration.ofMinutes(10));
    }

    public static GateSettings rpcDefaults() {
        return new GateSettings(5, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(5));
    }
}
