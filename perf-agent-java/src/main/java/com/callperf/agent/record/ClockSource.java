package com.callperf.agent.record;

import java.time.Instant;

/**
 * Time readings used by {@link CallRecorder}.
 * Any read may throw {@link MeasurementFailure}.
 */
public interface ClockSource {

    /** Monotonic wall-clock reading in nanoseconds. Only differences are meaningful. */
    long wallNanos();

    /** CPU time consumed so far, in nanoseconds. Only differences are meaningful. */
    long cpuNanos();

    /** Current point in time, used as the completion timestamp of a call. */
    Instant now();
}
