package com.callperf.daemon.store;

import com.callperf.daemon.sample.SystemSample;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persists sample batches as JSON arrays named {@code metrics-<firstMs>-<lastMs>.json}, so
 * readers can select files by time window from the name alone. Files are written to a temp
 * name and renamed into place.
 */
public class MetricFileStore {

    private static final Logger log = LoggerFactory.getLogger(MetricFileStore.class);

    public static final Pattern FILE_NAME = Pattern.compile("metrics-(\\d+)-(\\d+)\\.json");

    private static final Gson GSON = new GsonBuilder().create();
    private static final Type SAMPLE_LIST = new TypeToken<List<SystemSample>>() {}.getType();

    private final Path dataDir;

    public MetricFileStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    /** A metric file and the sample time range encoded in its name. */
    public record MetricFile(Path path, long firstMs, long lastMs) {}

    public record PruneResult(int deleted, int failed) {}

    /**
     * Writes one batch. Samples must be in timestamp order. A file already covering the same
     * range is merged with the batch rather than replaced.
     *
     * @return the written file, or null for an empty batch
     */
    public synchronized Path write(List<SystemSample> batch) throws IOException {
        if (batch.isEmpty()) return null;
        Files.createDirectories(dataDir);
        long first = batch.get(0).timestampMs();
        long last = batch.get(batch.size() - 1).timestampMs();
        Path target = dataDir.resolve("metrics-" + first + "-" + last + ".json");

        List<SystemSample> content = batch;
        if (Files.exists(target)) {
            Map<Long, SystemSample> merged = new TreeMap<>();
            for (SystemSample s : read(target)) merged.put(s.timestampMs(), s);
            for (SystemSample s : batch) merged.put(s.timestampMs(), s);
            content = new ArrayList<>(merged.values());
        }

        Path tmp = Files.createTempFile(dataDir, ".metrics-", ".tmp");
        try {
            Files.writeString(tmp, GSON.toJson(content, SAMPLE_LIST), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {} samples to {}", content.size(), target.getFileName());
        return target;
    }

    /** Metric files in the data directory, oldest first. */
    public List<MetricFile> files() throws IOException {
        List<MetricFile> files = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) return files;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, "metrics-*.json")) {
            for (Path path : stream) {
                Matcher m = FILE_NAME.matcher(path.getFileName().toString());
                if (m.matches()) {
                    files.add(new MetricFile(path, Long.parseLong(m.group(1)), Long.parseLong(m.group(2))));
                }
            }
        }
        files.sort(Comparator.comparingLong(MetricFile::firstMs).thenComparingLong(MetricFile::lastMs));
        return files;
    }

    /**
     * Deletes files whose newest sample is older than {@code cutoffMs}. Files straddling the
     * cutoff are kept whole. A file that cannot be deleted is logged and skipped.
     */
    public PruneResult prune(long cutoffMs) throws IOException {
        int deleted = 0;
        int failed = 0;
        for (MetricFile file : files()) {
            if (file.lastMs() >= cutoffMs) continue;
            try {
                Files.deleteIfExists(file.path());
                deleted++;
            } catch (IOException e) {
                failed++;
                log.warn("Could not delete expired metric file {}: {}", file.path(), e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Pruned {} metric file(s) older than {}", deleted, java.time.Instant.ofEpochMilli(cutoffMs));
        }
        return new PruneResult(deleted, failed);
    }

    public static List<SystemSample> read(Path file) throws IOException {
        try {
            List<SystemSample> samples = GSON.fromJson(Files.readString(file, StandardCharsets.UTF_8), SAMPLE_LIST);
            return samples != null ? samples : new ArrayList<>();
        } catch (JsonParseException e) {
            throw new IOException("Malformed metric file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path dataDir() { return dataDir; }
}
