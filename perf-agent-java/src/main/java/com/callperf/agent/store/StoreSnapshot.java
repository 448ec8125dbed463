package com.callperf.agent.store;

import com.callperf.agent.record.CallRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the store's contents, in per-function record order.
 * Handed back to {@link AggregationStore#remove(StoreSnapshot)} once a flush is acknowledged.
 */
public final class StoreSnapshot {

    private final Map<String, List<CallRecord>> byFunction;
    private final int size;

    StoreSnapshot(Map<String, List<CallRecord>> byFunction) {
        this.byFunction = Collections.unmodifiableMap(byFunction);
        this.size = byFunction.values().stream().mapToInt(List::size).sum();
    }

    public Map<String, List<CallRecord>> byFunction() {
        return byFunction;
    }

    /** All records, grouped by function in name order. */
    public List<CallRecord> records() {
        List<CallRecord> all = new ArrayList<>(size);
        byFunction.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
