package com.callperf.daemon.sample;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * One sampler tick. Serialized as an element of a metric file.
 *
 * JSON schema:
 * {
 *   "timestamp_ms": 1718000000000, "time": "2024-06-10T06:13:20Z",
 *   "cpu_percent": 12.5, "memory_percent": 48.2,
 *   "memory_used_bytes": 8123456512, "memory_total_bytes": 16842752000,
 *   "network": {"eth0": {"rx_bytes": 1, "tx_bytes": 2, "rx_packets": 3, "tx_packets": 4}},
 *   "processes": [{"pid": 42, "name": "java", "cpu_percent": 3.1, "rss_bytes": 524288000}]
 * }
 *
 * {@code network} and {@code processes} are null when not collected.
 */
public record SystemSample(
    @SerializedName("timestamp_ms")       long timestampMs,
    @SerializedName("time")               String time,
    @SerializedName("cpu_percent")        double cpuPercent,
    @SerializedName("memory_percent")     double memoryPercent,
    @SerializedName("memory_used_bytes")  long memoryUsedBytes,
    @SerializedName("memory_total_bytes") long memoryTotalBytes,
    @SerializedName("network")            Map<String, NetworkCounters> network,
    @SerializedName("processes")          List<ProcessUsage> processes
) {

    /** Copy of this sample with another timestamp. */
    public SystemSample withTimestamp(long epochMillis) {
        return new SystemSample(epochMillis, java.time.Instant.ofEpochMilli(epochMillis).toString(),
            cpuPercent, memoryPercent, memoryUsedBytes, memoryTotalBytes, network, processes);
    }

    /** Cumulative counters of one network interface. */
    public record NetworkCounters(
        @SerializedName("rx_bytes")   long rxBytes,
        @SerializedName("tx_bytes")   long txBytes,
        @SerializedName("rx_packets") long rxPackets,
        @SerializedName("tx_packets") long txPackets
    ) {}

    /**
     * Usage of one tracked process. {@code cpuPercent} is relative to one core since the
     * previous tick; {@code rssBytes} is -1 where the platform does not expose it.
     */
    public record ProcessUsage(
        @SerializedName("pid")         long pid,
        @SerializedName("name")        String name,
        @SerializedName("cpu_percent") double cpuPercent,
        @SerializedName("rss_bytes")   long rssBytes
    ) {}
}
