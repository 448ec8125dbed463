package com.callperf.agent.store;

import com.callperf.agent.record.CallRecord;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe, process-local map from function identity to its records in completion order.
 *
 * Appends from any number of threads interleave without loss. Summaries are recomputed from
 * the records on every request. Records leave the store only through {@link #clear()} or
 * {@link #remove(StoreSnapshot)}, which the upload path calls after a sink acknowledged them.
 */
public final class AggregationStore {

    private final ConcurrentHashMap<String, ConcurrentLinkedQueue<CallRecord>> records =
        new ConcurrentHashMap<>();

    private final AtomicInteger size = new AtomicInteger();

    public void record(CallRecord record) {
        size.incrementAndGet();
        records.computeIfAbsent(record.qualifiedName(), k -> new ConcurrentLinkedQueue<>()).add(record);
    }

    /** Summary for one function; a zero-count summary when nothing was recorded for it. */
    public FunctionSummary summary(String qualifiedName) {
        return FunctionSummary.of(qualifiedName, allRecords(qualifiedName));
    }

    /** Summaries of every function with at least one record, keyed and sorted by name. */
    public SortedMap<String, FunctionSummary> summaries() {
        SortedMap<String, FunctionSummary> result = new TreeMap<>();
        records.forEach((name, queue) -> {
            List<CallRecord> copy = new ArrayList<>(queue);
            if (!copy.isEmpty()) result.put(name, FunctionSummary.of(name, copy));
        });
        return result;
    }

    public List<CallRecord> allRecords(String qualifiedName) {
        Queue<CallRecord> queue = records.get(qualifiedName);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    public List<CallRecord> allRecords() {
        return snapshot().records();
    }

    /** Number of records currently held. */
    public int size() {
        return size.get();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public StoreSnapshot snapshot() {
        Map<String, List<CallRecord>> copy = new TreeMap<>();
        records.forEach((name, queue) -> {
            List<CallRecord> list = new ArrayList<>(queue);
            if (!list.isEmpty()) copy.put(name, list);
        });
        return new StoreSnapshot(copy);
    }

    /**
     * Removes exactly the records captured in {@code snapshot}, matched by identity. Records
     * appended after the snapshot was taken stay in the store, as do records some other removal
     * already took out. Callers must not remove overlapping snapshots concurrently.
     */
    public void remove(StoreSnapshot snapshot) {
        snapshot.byFunction().forEach((name, flushed) -> {
            Queue<CallRecord> queue = records.get(name);
            if (queue == null) return;
            Set<CallRecord> pending = Collections.newSetFromMap(new IdentityHashMap<>());
            pending.addAll(flushed);
            Iterator<CallRecord> it = queue.iterator();
            while (it.hasNext() && !pending.isEmpty()) {
                if (pending.remove(it.next())) {
                    it.remove();
                    size.decrementAndGet();
                }
            }
        });
    }

    public void clear() {
        for (Queue<CallRecord> queue : records.values()) {
            while (queue.poll() != null) {
                size.decrementAndGet();
            }
        }
    }
}
