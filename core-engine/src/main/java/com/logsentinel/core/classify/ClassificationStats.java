package com.logsentinel.core.classify;

import com.logsentinel.core.model.LogClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Monotonic per-class occurrence counters.
 *
 * @since 1.0.0
 */
public class ClassificationStats {

    private final AtomicLongArray counts = new AtomicLongArray(LogClass.COUNT);

    /**
     * @param classId class id in {@code [0, 6]}
     * @throws IndexOutOfBoundsException if {@code classId} is out of range
     */
    public void increment(int classId) {
        counts.incrementAndGet(classId);
    }

    public long count(int classId) {
        return counts.get(classId);
    }

    public long total() {
        long sum = 0;
        for (int i = 0; i < counts.length(); i++) {
            sum += counts.get(i);
        }
        return sum;
    }

    /**
     * @return class label to count, in class-id order
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (LogClass c : LogClass.values()) {
            out.put(c.label(), counts.get(c.id()));
        }
        return out;
    }
}
