package com.callperf.agent.correlate;

/**
 * System load observed around the calls of one function, from the samples joined to them.
 *
 * @param matchedCalls       calls that had a sample at or before their completion
 * @param avgCpuPercent      mean CPU percent over the joined samples
 * @param maxCpuPercent      highest CPU percent over the joined samples
 * @param avgMemoryPercent   mean memory percent over the joined samples
 * @param maxMemoryPercent   highest memory percent over the joined samples
 * @param maxMemoryUsedBytes highest used memory over the joined samples
 */
public record SystemLoad(
    int matchedCalls,
    double avgCpuPercent,
    double maxCpuPercent,
    double avgMemoryPercent,
    double maxMemoryPercent,
    long maxMemoryUsedBytes
) {}
