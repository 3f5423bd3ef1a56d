package com.example.DnsQueryLog.stats;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Occurrence counter keeping at most {@code capacity} keys; adding a key beyond that
 * evicts the least recently used one together with its count.
 * <p>
 * Not thread-safe. Reads change access order, so callers must hold an exclusive lock for them too.
 */
public class LruCounter {

    private final int capacity;
    private final LinkedHashMap<String, Integer> counts;

    public LruCounter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.counts = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > LruCounter.this.capacity;
            }
        };
    }

    public int increment(String key) {
        return counts.merge(key, 1, Integer::sum);
    }

    /** Returns 0 for keys that were never counted or have been evicted. */
    public int get(String key) {
        Integer value = counts.get(key);
        return value == null ? 0 : value;
    }

    /** Adds every key/count pair to {@code target}, summing with what is already there. */
    public void addTo(Map<String, Integer> target) {
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            target.merge(e.getKey(), e.getValue(), Integer::sum);
        }
    }

    public Map<String, Integer> snapshot() {
        return new HashMap<>(counts);
    }

    public int size() {
        return counts.size();
    }
}
