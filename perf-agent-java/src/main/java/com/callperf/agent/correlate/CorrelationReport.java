package com.callperf.agent.correlate;

import com.callperf.agent.store.FunctionSummary;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Function summaries over a time window, each annotated with the system load seen while the
 * function ran. When the sampler produced no data for the window, {@link #daemonDataAvailable()}
 * is false and every {@link FunctionLoad#load()} is null. {@link #sampler()} is the sampler's
 * own status file, or null when the directory has none.
 */
public record CorrelationReport(
    Instant from,
    Instant to,
    boolean daemonDataAvailable,
    int samplesRead,
    SamplerStatus sampler,
    List<FunctionLoad> functions
) {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .registerTypeAdapter(Instant.class, (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
        .create();

    /**
     * @param summary summary over the function's records inside the window
     * @param load    joined system load; null when no record could be joined
     */
    public record FunctionLoad(FunctionSummary summary, SystemLoad load) {}

    public Optional<FunctionLoad> function(String qualifiedName) {
        return functions.stream()
            .filter(f -> f.summary().qualifiedName().equals(qualifiedName))
            .findFirst();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /** Writes the report as pretty-printed JSON, creating parent directories. */
    public void write(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            GSON.toJson(this, w);
        }
    }
}
