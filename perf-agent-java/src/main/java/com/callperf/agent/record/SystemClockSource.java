package com.callperf.agent.record;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Instant;

/**
 * Clock backed by {@link System#nanoTime()} and the JVM management beans.
 *
 * CPU time is read per thread, so a call is charged only for the CPU its own thread used.
 * When the JVM does not support thread CPU time, process CPU time is used instead.
 */
public final class SystemClockSource implements ClockSource {

    private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    private final boolean threadCpuSupported;

    public SystemClockSource() {
        boolean supported = false;
        try {
            supported = threads.isCurrentThreadCpuTimeSupported();
            if (supported && !threads.isThreadCpuTimeEnabled()) {
                threads.setThreadCpuTimeEnabled(true);
            }
        } catch (UnsupportedOperationException | SecurityException e) {
            supported = false;
        }
        this.threadCpuSupported = supported;
    }

    @Override
    public long wallNanos() {
        return System.nanoTime();
    }

    @Override
    public long cpuNanos() {
        if (threadCpuSupported) {
            long nanos = threads.getCurrentThreadCpuTime();
            if (nanos >= 0) return nanos;
        }
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long nanos = sunOs.getProcessCpuTime();
            if (nanos >= 0) return nanos;
        }
        throw new MeasurementFailure("CPU time is not available on this JVM");
    }

    @Override
    public Instant now() {
        return Instant.now();
    }
}
