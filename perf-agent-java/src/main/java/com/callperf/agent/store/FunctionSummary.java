package com.callperf.agent.store;

import com.callperf.agent.record.CallRecord;

import java.util.Collection;

/**
 * Aggregate statistics over the records of one function. Derived on demand, never stored.
 */
public record FunctionSummary(
    String qualifiedName,
    long callCount,
    Stats wallTime,
    Stats cpuTime
) {

    /** Total, average, minimum and maximum of one duration series, in seconds. */
    public record Stats(double total, double average, double min, double max) {
        static final Stats EMPTY = new Stats(0, 0, 0, 0);
    }

    public static FunctionSummary of(String qualifiedName, Collection<CallRecord> records) {
        if (records.isEmpty()) {
            return new FunctionSummary(qualifiedName, 0, Stats.EMPTY, Stats.EMPTY);
        }
        long count = 0;
        double wallTotal = 0, wallMin = Double.MAX_VALUE, wallMax = 0;
        double cpuTotal = 0, cpuMin = Double.MAX_VALUE, cpuMax = 0;
        for (CallRecord r : records) {
            count++;
            wallTotal += r.wallTime();
            wallMin = Math.min(wallMin, r.wallTime());
            wallMax = Math.max(wallMax, r.wallTime());
            cpuTotal += r.cpuTime();
            cpuMin = Math.min(cpuMin, r.cpuTime());
            cpuMax = Math.max(cpuMax, r.cpuTime());
        }
        return new FunctionSummary(
            qualifiedName,
            count,
            new Stats(wallTotal, wallTotal / count, wallMin, wallMax),
            new Stats(cpuTotal, cpuTotal / count, cpuMin, cpuMax));
    }
}
