package com.callperf.agent.correlate;

import com.google.gson.annotations.SerializedName;

/**
 * Read model of one system sample in a sampler metric file.
 * Only the fields used for correlation are declared; the rest of the JSON is ignored.
 */
public class ObservedSample {

    @SerializedName("timestamp_ms")      public long timestampMs;
    @SerializedName("cpu_percent")       public double cpuPercent;
    @SerializedName("memory_percent")    public double memoryPercent;
    @SerializedName("memory_used_bytes") public long memoryUsedBytes;

    public ObservedSample() {}

    public ObservedSample(long timestampMs, double cpuPercent, double memoryPercent, long memoryUsedBytes) {
        this.timestampMs = timestampMs;
        this.cpuPercent = cpuPercent;
        this.memoryPercent = memoryPercent;
        this.memoryUsedBytes = memoryUsedBytes;
    }
}
