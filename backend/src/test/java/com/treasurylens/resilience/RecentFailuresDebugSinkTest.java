package com.treasurylens.resilience;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentFailuresDebugSinkTest {

    @Test
    void keepsMostRecentRecordsUpToCapacity() {
        RecentFailuresDebugSink sink = new RecentFailuresDebugSink(2);
        sink.record(record("a"));
        sink.record(record("b"));
        sink.record(record("c"));

        assertThat(sink.recent()).extracting(DebugRecord::callId).containsExactly("b", "c");
    }

    @Test
    void clear_emptiesBuffer() {
        RecentFailuresDebugSink sink = new RecentFailuresDebugSink(5);
        sink.record(record("a"));
        sink.clear();
        assertThat(sink.recent()).isEmpty();
    }

    @Test
    void record_dropsNullVariables() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("projectId", 1L);
        variables.put("after", null);
        DebugRecord record = new DebugRecord("indexer", "payEvents", variables, "down", null, Instant.now());
        assertThat(record.variables()).containsOnlyKeys("projectId");
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecentFailuresDebugSink(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static DebugRecord record(String callId) {
        return new DebugRecord("rpc", callId, Map.of(), "boom", "java.lang.IllegalStateException", Instant.now());
    }
}
