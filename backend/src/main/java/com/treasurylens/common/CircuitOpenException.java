package com.treasurylens.common;

import java.time.Duration;

/**
 * Raised when a call was short-circuited by an open gate. No network attempt was made.
 */
public class CircuitOpenException extends TreasuryDataException {

    private final String gate;
    private final Duration retryAfter;

    public CircuitOpenException(String gate, Duration retryAfter) {
        super(ErrorKind.CIRCUIT_OPEN, "Circuit '" + gate + "' is open, retry after " + retryAfter.toMillis() + " ms");
        this.gate = gate;
        this.retryAfter = retryAfter;
    }

    public String getGate() {
        return gate;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
