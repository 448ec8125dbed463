package com.callperf.agent.record;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One measured invocation. Immutable.
 *
 * @param qualifiedName class name and method name joined by '.'
 * @param wallTime      elapsed wall-clock seconds, never negative
 * @param cpuTime       CPU seconds consumed by the calling thread, never negative
 * @param timestamp     completion time of the call
 * @param arguments     per-argument snapshots; null unless argument tracking is enabled
 * @param thrown        simple class name of an exception that escaped the call, or null
 */
public record CallRecord(
    String qualifiedName,
    double wallTime,
    double cpuTime,
    Instant timestamp,
    List<Map<String, String>> arguments,
    String thrown
) {

    public CallRecord {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        Objects.requireNonNull(timestamp, "timestamp");
        if (wallTime < 0) throw new IllegalArgumentException("wallTime must be >= 0: " + wallTime);
        if (cpuTime < 0) throw new IllegalArgumentException("cpuTime must be >= 0: " + cpuTime);
        arguments = arguments == null ? null : List.copyOf(arguments);
    }

    public CallRecord(String qualifiedName, double wallTime, double cpuTime, Instant timestamp) {
        this(qualifiedName, wallTime, cpuTime, timestamp, null, null);
    }

    /** Class (module) part of the qualified name. */
    public String module() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? "" : qualifiedName.substring(0, dot);
    }

    /** Method (function) part of the qualified name. */
    public String function() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }
}
