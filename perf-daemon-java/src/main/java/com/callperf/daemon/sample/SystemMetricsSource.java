package com.callperf.daemon.sample;

/** Reads whole-system resource usage. */
public interface SystemMetricsSource {

    /** Takes one sample stamped with {@code epochMillis}. */
    SystemSample sample(long epochMillis);
}
