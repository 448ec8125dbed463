package com.callperf.daemon;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Sampler daemon configuration, deserialized by {@link DaemonConfigReader} from JSON with
 * snake_case keys or built in code. Unset values fall back to defaults.
 */
public class DaemonConfig {

    @SerializedName("data_dir")             private String dataDir;
    /** Seconds between samples. */
    @SerializedName("sample_interval")      private Double sampleInterval;
    /** Seconds between metric file flushes. */
    @SerializedName("flush_interval")       private Double flushInterval;
    @SerializedName("data_retention_hours") private Double dataRetentionHours;
    @SerializedName("buffer_capacity")      private Integer bufferCapacity;
    @SerializedName("cpu_threshold")        private Double cpuThreshold;
    @SerializedName("memory_threshold")     private Double memoryThreshold;
    @SerializedName("collect_network")      private Boolean collectNetwork;
    /** Regexes matched against process command lines; matching processes are sampled individually. */
    @SerializedName("track_processes")      private List<String> trackProcesses;

    public Path getDataDir()            { return Paths.get(dataDir != null ? dataDir : "./perf_daemon_data"); }
    public Duration getSampleInterval() { return seconds(sampleInterval != null ? sampleInterval : 1.0); }
    public Duration getFlushInterval()  { return seconds(flushInterval != null ? flushInterval : 60.0); }
    public Duration getRetention()      { return seconds((dataRetentionHours != null ? dataRetentionHours : 168.0) * 3600); }
    public int getBufferCapacity()      { return bufferCapacity != null ? bufferCapacity : 3600; }
    public double getCpuThreshold()     { return cpuThreshold != null ? cpuThreshold : 90.0; }
    public double getMemoryThreshold()  { return memoryThreshold != null ? memoryThreshold : 90.0; }
    public boolean isCollectNetwork()   { return collectNetwork == null || collectNetwork; }
    public List<String> getTrackProcesses() {
        return trackProcesses != null ? trackProcesses : Collections.emptyList();
    }

    public DaemonConfig setDataDir(Path dataDir)                 { this.dataDir = dataDir.toString(); return this; }
    public DaemonConfig setSampleInterval(double seconds)        { this.sampleInterval = seconds; return this; }
    public DaemonConfig setFlushInterval(double seconds)         { this.flushInterval = seconds; return this; }
    public DaemonConfig setDataRetentionHours(double hours)      { this.dataRetentionHours = hours; return this; }
    public DaemonConfig setBufferCapacity(int capacity)          { this.bufferCapacity = capacity; return this; }
    public DaemonConfig setCpuThreshold(double percent)          { this.cpuThreshold = percent; return this; }
    public DaemonConfig setMemoryThreshold(double percent)       { this.memoryThreshold = percent; return this; }
    public DaemonConfig setCollectNetwork(boolean collect)       { this.collectNetwork = collect; return this; }
    public DaemonConfig setTrackProcesses(List<String> patterns) { this.trackProcesses = patterns; return this; }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.max(1L, Math.round(value * 1000)));
    }
}
