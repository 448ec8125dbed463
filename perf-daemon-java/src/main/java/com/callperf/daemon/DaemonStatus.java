package com.callperf.daemon;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Point-in-time daemon status, also persisted as {@code sampler.status.json} in the data directory. */
public record DaemonStatus(
    @SerializedName("state")            DaemonState state,
    @SerializedName("running")          boolean running,
    @SerializedName("pid")              long pid,
    @SerializedName("data_dir")         String dataDir,
    @SerializedName("started_at")       String startedAt,
    @SerializedName("last_sample_time") String lastSampleTime,
    @SerializedName("last_flush_time")  String lastFlushTime,
    @SerializedName("samples_taken")    long samplesTaken,
    @SerializedName("buffered_samples") int bufferedSamples,
    @SerializedName("alerts_raised")    long alertsRaised,
    @SerializedName("metric_files")     int metricFiles
) {

    public static final String STATUS_FILE = "sampler.status.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public String toJson() {
        return GSON.toJson(this);
    }

    /** Copy reporting another state and running flag, used when the file outlived its daemon. */
    public DaemonStatus withState(DaemonState newState, boolean isRunning) {
        return new DaemonStatus(newState, isRunning, pid, dataDir, startedAt, lastSampleTime,
            lastFlushTime, samplesTaken, bufferedSamples, alertsRaised, metricFiles);
    }

    void writeTo(Path dataDir) throws IOException {
        Path tmp = Files.createTempFile(dataDir, ".status-", ".tmp");
        try {
            Files.writeString(tmp, toJson(), StandardCharsets.UTF_8);
            Files.move(tmp, dataDir.resolve(STATUS_FILE), StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Reads the status file, or returns null if there is none. */
    static DaemonStatus readFrom(Path dataDir) throws IOException {
        Path file = dataDir.resolve(STATUS_FILE);
        if (!Files.exists(file)) return null;
        try {
            return GSON.fromJson(Files.readString(file, StandardCharsets.UTF_8), DaemonStatus.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed status file " + file + ": " + e.getMessage(), e);
        }
    }
}
