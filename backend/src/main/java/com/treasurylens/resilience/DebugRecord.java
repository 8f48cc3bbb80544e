package com.treasurylens.resilience;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure report handed to the {@link DebugSink}: which dependency, which call, with what variables, and why.
 * Null-valued variables are dropped.
 */
public record DebugRecord(
        String source,
        String callId,
        Map<String, Object> variables,
        String error,
        String errorDetails,
        Instant at
) {

    public DebugRecord {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (variables != null) {
            variables.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        variables = Collections.unmodifiableMap(copy);
    }
}
