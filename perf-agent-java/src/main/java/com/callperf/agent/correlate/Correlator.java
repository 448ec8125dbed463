package com.callperf.agent.correlate;

import com.callperf.agent.record.CallRecord;
import com.callperf.agent.store.AggregationStore;
import com.callperf.agent.store.FunctionSummary;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Joins call records against the sampler's metric files.
 *
 * Each record completed inside the window gets the nearest sample whose timestamp is not after
 * the record's timestamp. Metric files are found by the sample range encoded in their names
 * ({@code metrics-<firstMs>-<lastMs>.json}); files ending up to {@code lookback} before the
 * window start are also read so the first calls of the window can join an earlier sample.
 * The sampler's status file, when present, is attached to the report as recorded.
 * Reads only: neither the store nor the metric files are modified, and no lock is taken.
 */
public class Correlator {

    private static final Logger log = LoggerFactory.getLogger(Correlator.class);

    static final Pattern METRIC_FILE = Pattern.compile("metrics-(\\d+)-(\\d+)\\.json");
    private static final Type SAMPLE_LIST = new TypeToken<List<ObservedSample>>() {}.getType();
    private static final Gson GSON = new Gson();

    private final Path metricsDir;
    private final Duration lookback;

    public Correlator(Path metricsDir) {
        this(metricsDir, Duration.ofMinutes(5));
    }

    public Correlator(Path metricsDir, Duration lookback) {
        this.metricsDir = metricsDir;
        this.lookback = lookback;
    }

    public CorrelationReport correlate(AggregationStore store, Instant from, Instant to) {
        SamplerStatus sampler = readStatus();
        List<ObservedSample> samples = readSamples(from.minus(lookback), to);
        long[] times = samples.stream().mapToLong(s -> s.timestampMs).toArray();

        List<CorrelationReport.FunctionLoad> functions = new ArrayList<>();
        for (String name : store.summaries().keySet()) {
            List<CallRecord> inWindow = store.allRecords(name).stream()
                .filter(r -> !r.timestamp().isBefore(from) && !r.timestamp().isAfter(to))
                .toList();
            if (inWindow.isEmpty()) continue;
            FunctionSummary summary = FunctionSummary.of(name, inWindow);
            SystemLoad load = samples.isEmpty() ? null : join(inWindow, samples, times);
            functions.add(new CorrelationReport.FunctionLoad(summary, load));
        }
        return new CorrelationReport(from, to, !samples.isEmpty(), samples.size(), sampler, functions);
    }

    private static SystemLoad join(List<CallRecord> records, List<ObservedSample> samples, long[] times) {
        int matched = 0;
        double cpuSum = 0, cpuMax = 0, memSum = 0, memMax = 0;
        long memUsedMax = 0;
        for (CallRecord r : records) {
            int idx = nearestNotAfter(times, r.timestamp().toEpochMilli());
            if (idx < 0) continue;
            ObservedSample s = samples.get(idx);
            matched++;
            cpuSum += s.cpuPercent;
            cpuMax = Math.max(cpuMax, s.cpuPercent);
            memSum += s.memoryPercent;
            memMax = Math.max(memMax, s.memoryPercent);
            memUsedMax = Math.max(memUsedMax, s.memoryUsedBytes);
        }
        if (matched == 0) return null;
        return new SystemLoad(matched, cpuSum / matched, cpuMax, memSum / matched, memMax, memUsedMax);
    }

    /** Index of the last element {@code <= target} in ascending {@code times}, or -1. */
    static int nearestNotAfter(long[] times, long target) {
        int lo = 0, hi = times.length - 1, found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= target) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    /** The sampler's last persisted status, or null when it never wrote one here. */
    SamplerStatus readStatus() {
        Path file = metricsDir.resolve(SamplerStatus.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            log.debug("No sampler status in {}", metricsDir);
            return null;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return GSON.fromJson(reader, SamplerStatus.class);
        } catch (IOException | JsonParseException e) {
            // replaced by the sampler between our check and the read
            log.warn("Ignoring unreadable sampler status {}: {}", file, e.getMessage());
            return null;
        }
    }

    /** Samples from files overlapping [from, to], sorted by timestamp with duplicates removed. */
    List<ObservedSample> readSamples(Instant from, Instant to) {
        if (!Files.isDirectory(metricsDir)) {
            log.debug("No sampler data directory at {}; reporting without system load", metricsDir);
            return List.of();
        }
        long fromMs = from.toEpochMilli();
        long toMs = to.toEpochMilli();

        List<Path> files;
        try (Stream<Path> listing = Files.list(metricsDir)) {
            files = listing.filter(p -> overlaps(p, fromMs, toMs)).sorted().toList();
        } catch (IOException e) {
            log.warn("Could not list sampler data in {}: {}", metricsDir, e.getMessage());
            return List.of();
        }

        TreeMap<Long, ObservedSample> byTime = new TreeMap<>();
        for (Path file : files) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                List<ObservedSample> batch = GSON.fromJson(reader, SAMPLE_LIST);
                if (batch == null) continue;
                for (ObservedSample s : batch) {
                    if (s != null) byTime.putIfAbsent(s.timestampMs, s);
                }
            } catch (IOException | JsonParseException e) {
                // the sampler may have pruned the file since it was listed
                log.warn("Skipping unreadable metric file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        if (byTime.isEmpty()) {
            log.debug("No sampler data in {} for {} .. {}", metricsDir, from, to);
        }
        return new ArrayList<>(byTime.values());
    }

    private static boolean overlaps(Path file, long fromMs, long toMs) {
        Matcher m = METRIC_FILE.matcher(file.getFileName().toString());
        if (!m.matches()) return false;
        long first = Long.parseLong(m.group(1));
        long last = Long.parseLong(m.group(2));
        return first <= toMs && last >= fromMs;
    }
}
