package com.treasurylens.resilience;

/**
 * Receives gate failures and circuit-open events for a debugging view. Must return quickly;
 * anything it throws is logged by the gate and otherwise ignored.
 */
public interface DebugSink {

    void record(DebugRecord record);

    DebugSink NOOP = record -> { };
}
