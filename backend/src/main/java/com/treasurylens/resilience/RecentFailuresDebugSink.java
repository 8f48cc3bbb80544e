package com.treasurylens.resilience;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Logs every record and keeps the most recent ones in a bounded buffer, newest last.
 */
@Slf4j
public class RecentFailuresDebugSink implements DebugSink {

    private final int capacity;
    private final Deque<DebugRecord> buffer;

    public RecentFailuresDebugSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public void record(DebugRecord record) {
        log.debug("[{}] {} failed: {} {}", record.source(), record.callId(), record.error(), record.variables());
        synchronized (buffer) {
            if (buffer.size() == capacity) {
                buffer.removeFirst();
            }
            buffer.addLast(record);
        }
    }

    public List<DebugRecord> recent() {
        synchronized (buffer) {
            return new ArrayList<>(buffer);
        }
    }

    public void clear() {
        synchronized (buffer) {
            buffer.clear();
        }
    }
}
