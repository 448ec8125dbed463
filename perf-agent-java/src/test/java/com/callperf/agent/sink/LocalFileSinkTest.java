package com.callperf.agent.sink;

import com.callperf.agent.record.CallRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileSinkTest {

    @TempDir
    Path dir;

    private static final Instant START = Instant.parse("2024-06-10T12:00:00Z");

    private static List<CallRecord> records(int n) {
        List<CallRecord> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(new CallRecord("app.Svc.call" + (i % 2), 0.01 * (i + 1), 0.005, START.plusSeconds(i)));
        }
        return list;
    }

    private static FlushMetadata meta(long offsetMillis) {
        return new FlushMetadata("host-1", START, START.plusMillis(offsetMillis), "manual");
    }

    @Test
    void writesJsonFlushFile() throws Exception {
        LocalFileSink sink = new LocalFileSink(dir, "json", 1000);

        SinkResult result = sink.write("session-1", records(3), meta(1000));

        assertEquals(3, result.recordCount());
        Path file = Path.of(result.location());
        assertTrue(Files.exists(file));
        assertTrue(file.getFileName().toString().matches("perf-\\d{13}-\\d{6}-3\\.json"));
        FlushPayload payload = FlushPayload.fromJson(Files.readString(file));
        assertEquals("session-1", payload.sessionId);
        assertEquals("host-1", payload.hostname);
        assertEquals(3, payload.totalCalls);
        assertEquals(2, payload.summaries.size());
        assertEquals("app.Svc.call0", payload.summaries.get(0).function);
        assertEquals(3, payload.records.size());
    }

    @Test
    void writesCsvWithHeader() throws Exception {
        LocalFileSink sink = new LocalFileSink(dir, "csv", 1000);
        SinkResult result = sink.write("s", records(2), meta(0));

        List<String> lines = Files.readAllLines(Path.of(result.location()));
        assertEquals("session_id,hostname,function,wall_time,cpu_time,timestamp,thrown", lines.get(0));
        assertEquals(3, lines.size());
        assertTrue(lines.get(1).startsWith("s,host-1,app.Svc.call0,0.01,"));
    }

    @Test
    void unsupportedFormatIsPermanentFailure() {
        LocalFileSink sink = new LocalFileSink(dir, "sqlite", 1000);
        assertThrows(PermanentDeliveryException.class, () -> sink.write("s", records(1), meta(0)));
    }

    @Test
    void unwritableDirectoryIsTransientFailure() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");
        LocalFileSink sink = new LocalFileSink(blocker.resolve("data"), "json", 1000);

        DeliveryException e = assertThrows(DeliveryException.class, () -> sink.write("s", records(1), meta(0)));
        assertTrue(e.isRetryable());
    }

    @Test
    void evictsOldestFilesOverRecordCap() {
        LocalFileSink sink = new LocalFileSink(dir, "json", 5);

        sink.write("s", records(2), meta(1000));
        sink.write("s", records(2), meta(2000));
        sink.write("s", records(2), meta(3000));

        List<Path> files = sink.files();
        assertEquals(2, files.size());
        assertEquals(4, sink.storedRecords());
        assertTrue(files.get(0).getFileName().toString().contains(String.format("%013d", START.plusMillis(2000).toEpochMilli())),
            "oldest file was evicted first");
    }

    @Test
    void newestFileIsKeptEvenWhenAloneOverCap() {
        LocalFileSink sink = new LocalFileSink(dir, "json", 2);

        sink.write("s", records(2), meta(1000));
        sink.write("s", records(10), meta(2000));

        List<Path> files = sink.files();
        assertEquals(1, files.size());
        assertTrue(files.get(0).getFileName().toString().endsWith("-10.json"));
    }

    @Test
    void sameMillisecondFlushesGetDistinctFiles() {
        LocalFileSink sink = new LocalFileSink(dir, "json", 1000);
        sink.write("s", records(1), meta(0));
        sink.write("s", records(1), meta(0));
        assertEquals(2, sink.files().size());
    }

    @Test
    void noTemporaryFilesLeftBehind() throws Exception {
        LocalFileSink sink = new LocalFileSink(dir, "json", 1000);
        sink.write("s", records(1), meta(0));
        try (var listing = Files.list(dir)) {
            assertTrue(listing.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }
}
