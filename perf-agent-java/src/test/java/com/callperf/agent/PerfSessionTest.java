package com.callperf.agent;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.correlate.CorrelationReport;
import com.callperf.agent.record.FakeClockSource;
import com.callperf.agent.record.CallRecord;
import com.callperf.agent.record.Measurement;
import com.callperf.agent.sink.FlushMetadata;
import com.callperf.agent.sink.LocalFileSink;
import com.callperf.agent.sink.Sink;
import com.callperf.agent.sink.SinkResult;
import com.callperf.agent.upload.FlushOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PerfSessionTest {

    @TempDir
    Path dir;

    private PerfConfig config(String strategy) {
        PerfConfig config = new PerfConfig();
        config.core().setMinExecutionTime(0.01);
        config.local().setDataDir(dir.resolve("data")).setFallbackDir(dir.resolve("fallback"));
        config.upload().setStrategy(strategy);
        return config;
    }

    @Test
    void closeFlushesRecordsToLocalFiles() {
        FakeClockSource clock = new FakeClockSource();
        PerfSession session = PerfSession.builder(config("on_exit")).clockSource(clock).hostname("test-host").build();

        for (int i = 0; i < 5; i++) {
            session.recorder().run("app.Work.fast", () -> clock.advance(0.005));
        }
        for (int i = 0; i < 3; i++) {
            session.recorder().run("app.Work.slow", () -> clock.advance(0.02));
        }
        assertEquals(3, session.summary("app.Work.slow").callCount());
        assertEquals(0, session.summary("app.Work.fast").callCount());

        session.close();

        assertTrue(session.isClosed());
        assertTrue(session.store().isEmpty());
        LocalFileSink files = new LocalFileSink(dir.resolve("data"), "json", 1000);
        assertEquals(1, files.files().size());
        assertEquals(3, files.storedRecords());
    }

    @Test
    void closeIsIdempotent() {
        FakeClockSource clock = new FakeClockSource();
        PerfSession session = PerfSession.builder(config("on_exit")).clockSource(clock).build();
        session.recorder().run("app.Work.slow", () -> clock.advance(0.02));

        session.close();
        session.close();

        assertEquals(1, new LocalFileSink(dir.resolve("data"), "json", 1000).files().size());
    }

    @Test
    void manualFlushThroughSession() {
        FakeClockSource clock = new FakeClockSource();
        try (PerfSession session = PerfSession.builder(config("manual")).clockSource(clock).build()) {
            try (Measurement m = session.start("app.Work.slow")) {
                clock.advance(0.05);
            }
            assertEquals(FlushOutcome.DELIVERED, session.flush());
            assertEquals(FlushOutcome.EMPTY, session.flush());
        }
    }

    @Test
    void sessionsHaveDistinctIds() {
        try (PerfSession a = PerfSession.open(config("manual"));
             PerfSession b = PerfSession.open(config("manual"))) {
            assertNotEquals(a.sessionId(), b.sessionId());
        }
    }

    @Test
    void correlationReportWithoutSamplerData() {
        FakeClockSource clock = new FakeClockSource();
        try (PerfSession session = PerfSession.builder(config("manual")).clockSource(clock).build()) {
            session.recorder().run("app.Work.slow", () -> clock.advance(0.02));

            CorrelationReport report = session.correlationReport(dir.resolve("no-sampler"));

            assertFalse(report.daemonDataAvailable());
            assertEquals(1, report.function("app.Work.slow").orElseThrow().summary().callCount());
        }
    }

    @Test
    void shutdownHookClosesSession() {
        PerfSession session = PerfSession.open(config("manual"));
        new SessionShutdownHook(session).run();
        assertTrue(session.isClosed());
    }

    @Test
    void callsAfterCloseRunUninstrumented() {
        FakeClockSource clock = new FakeClockSource();
        AtomicInteger writes = new AtomicInteger();
        Sink counting = new Sink() {
            @Override
            public SinkResult write(String sessionId, List<CallRecord> records, FlushMetadata metadata) {
                writes.incrementAndGet();
                return new SinkResult("counting", records.size());
            }

            @Override
            public String name() {
                return "counting";
            }
        };
        PerfSession session = PerfSession.builder(config("real_time")).clockSource(clock)
            .primarySink(counting).fallbackSink(counting).build();
        try (Measurement open = session.start("app.Work.straddling")) {
            session.recorder().run("app.Work.slow", () -> clock.advance(0.02));
            session.close();
            clock.advance(0.02);
        }

        String result = session.recorder().time("app.Work.slow", () -> {
            clock.advance(0.02);
            return "done";
        });

        assertEquals("done", result);
        assertEquals(1, writes.get());
        assertTrue(session.store().isEmpty());
        assertTrue(session.start("app.Work.slow").isNoop());
    }
}
