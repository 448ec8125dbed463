package com.callperf.daemon.store;

import com.callperf.daemon.sample.SystemSample;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded in-memory sample buffer. When full, the oldest sample is evicted to make room.
 * All methods are synchronized; the sampling loop and the flush worker share one instance.
 */
public class SampleRingBuffer {

    private final int capacity;
    private final ArrayDeque<SystemSample> samples;
    private long evicted;

    public SampleRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    public synchronized void add(SystemSample sample) {
        if (samples.size() == capacity) {
            samples.pollFirst();
            evicted++;
        }
        samples.addLast(sample);
    }

    /** Removes and returns every buffered sample, oldest first. */
    public synchronized List<SystemSample> drain() {
        List<SystemSample> drained = new ArrayList<>(samples);
        samples.clear();
        return drained;
    }

    /**
     * Puts samples from a failed flush back in front of anything buffered since. If that
     * overflows the capacity, the oldest samples are the ones dropped.
     */
    public synchronized void requeueFront(List<SystemSample> batch) {
        for (int i = batch.size() - 1; i >= 0; i--) {
            if (samples.size() == capacity) {
                evicted += i + 1;
                return;
            }
            samples.addFirst(batch.get(i));
        }
    }

    public synchronized int size() { return samples.size(); }

    public int capacity() { return capacity; }

    /** Samples lost to overflow since creation. */
    public synchronized long evicted() { return evicted; }
}
