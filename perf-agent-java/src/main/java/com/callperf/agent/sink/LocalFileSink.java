package com.callperf.agent.sink;

import com.callperf.agent.record.CallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes one file per flush under a data directory and keeps the directory under a record cap.
 *
 * File names are {@code perf-<epochMillis>-<seq>-<recordCount>.<ext>}, so a directory listing
 * sorts oldest first and eviction needs no file reads. Files are written to a temporary name
 * and renamed into place; readers never see a partial file. Once the records across all files
 * exceed {@code maxRecords}, the oldest files are deleted first; the newest file is always kept.
 */
public class LocalFileSink implements Sink {

    private static final Logger log = LoggerFactory.getLogger(LocalFileSink.class);

    static final Pattern FILE_NAME = Pattern.compile("perf-(\\d+)-(\\d+)-(\\d+)\\.(json|csv)");

    private final Path dataDir;
    private final String format;
    private final int maxRecords;
    private final AtomicLong sequence = new AtomicLong();

    public LocalFileSink(Path dataDir, String format, int maxRecords) {
        this.dataDir = dataDir;
        this.format = format == null ? "json" : format.toLowerCase(Locale.ROOT);
        this.maxRecords = maxRecords;
    }

    @Override
    public String name() {
        return "local:" + dataDir;
    }

    public Path dataDir() {
        return dataDir;
    }

    @Override
    public synchronized SinkResult write(String sessionId, List<CallRecord> records, FlushMetadata metadata) {
        if (!format.equals("json") && !format.equals("csv")) {
            throw new PermanentDeliveryException("Unsupported local storage format: " + format);
        }
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new TransientDeliveryException("Could not create data directory: " + dataDir, e);
        }

        String content = format.equals("csv")
            ? toCsv(sessionId, records, metadata)
            : FlushPayload.build(sessionId, records, metadata).toPrettyJson();

        Path target = writeAtomically(content, metadata.flushTime().toEpochMilli(), records.size());
        log.debug("Wrote {} records to {}", records.size(), target);

        evictOldest();
        return new SinkResult(target.toString(), records.size());
    }

    private Path writeAtomically(String content, long epochMillis, int count) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dataDir, ".perf-", ".tmp");
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(content);
            }
            while (true) {
                Path target = dataDir.resolve(String.format(Locale.ROOT, "perf-%013d-%06d-%d.%s",
                    epochMillis, sequence.incrementAndGet() % 1_000_000, count, format));
                if (Files.exists(target)) continue;
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                return target;
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new TransientDeliveryException("Failed to write flush file in " + dataDir + ": " + e.getMessage(), e);
        }
    }

    /** Flush files in the data directory, oldest first. */
    public List<Path> files() {
        if (!Files.isDirectory(dataDir)) return List.of();
        try (Stream<Path> listing = Files.list(dataDir)) {
            return listing
                .filter(p -> FILE_NAME.matcher(p.getFileName().toString()).matches())
                .sorted(Comparator.comparingLong((Path p) -> nameField(p, 1))
                    .thenComparingLong(p -> nameField(p, 2)))
                .toList();
        } catch (IOException e) {
            log.warn("Could not list {}: {}", dataDir, e.getMessage());
            return List.of();
        }
    }

    /** Total records across all flush files, read from their names. */
    public long storedRecords() {
        return files().stream().mapToLong(p -> nameField(p, 3)).sum();
    }

    void evictOldest() {
        List<Path> files = new ArrayList<>(files());
        long total = files.stream().mapToLong(p -> nameField(p, 3)).sum();
        while (total > maxRecords && files.size() > 1) {
            Path oldest = files.remove(0);
            try {
                Files.deleteIfExists(oldest);
                total -= nameField(oldest, 3);
                log.debug("Evicted {} to stay under {} records", oldest.getFileName(), maxRecords);
            } catch (IOException e) {
                // deleting newer files instead would break oldest-first order
                log.warn("Could not evict {}: {}", oldest, e.getMessage());
                return;
            }
        }
    }

    private static long nameField(Path p, int group) {
        Matcher m = FILE_NAME.matcher(p.getFileName().toString());
        return m.matches() ? Long.parseLong(m.group(group)) : 0L;
    }

    private static String toCsv(String sessionId, List<CallRecord> records, FlushMetadata metadata) {
        StringBuilder sb = new StringBuilder("session_id,hostname,function,wall_time,cpu_time,timestamp,thrown\n");
        for (CallRecord r : records) {
            sb.append(csv(sessionId)).append(',')
              .append(csv(metadata.hostname())).append(',')
              .append(csv(r.qualifiedName())).append(',')
              .append(r.wallTime()).append(',')
              .append(r.cpuTime()).append(',')
              .append(r.timestamp()).append(',')
              .append(csv(r.thrown() == null ? "" : r.thrown()))
              .append('\n');
        }
        return sb.toString();
    }

    private static String csv(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) return value;
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not remove temporary file {}: {}", p, e.getMessage());
        }
    }
}
