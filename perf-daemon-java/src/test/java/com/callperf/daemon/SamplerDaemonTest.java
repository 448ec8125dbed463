package com.callperf.daemon;

import com.callperf.daemon.sample.SystemSample;
import com.callperf.daemon.store.DataDirLock;
import com.callperf.daemon.store.MetricFileStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SamplerDaemonTest {

    @TempDir
    Path dataDir;

    private final List<SamplerDaemon> started = new ArrayList<>();

    @AfterEach
    void stopAll() {
        started.forEach(SamplerDaemon::stop);
    }

    private DaemonConfig config() {
        return new DaemonConfig()
            .setDataDir(dataDir)
            .setSampleInterval(0.02)
            .setFlushInterval(0.1)
            .setCpuThreshold(90)
            .setMemoryThreshold(90);
    }

    private SamplerDaemon daemon(DaemonConfig config, FakeMetricsSource source, Clock clock) {
        SamplerDaemon daemon = new SamplerDaemon(config, source, clock);
        started.add(daemon);
        return daemon;
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not reached within 5s");
            Thread.sleep(10);
        }
    }

    @Test
    void startRunStopLifecycle() throws Exception {
        FakeMetricsSource source = new FakeMetricsSource();
        SamplerDaemon daemon = daemon(config(), source, Clock.systemUTC());
        assertEquals(DaemonState.STOPPED, daemon.state());

        daemon.start();
        assertEquals(DaemonState.RUNNING, daemon.state());
        assertTrue(DataDirLock.isHeld(dataDir));

        waitFor(() -> source.calls.get() >= 5);
        daemon.stop();

        assertEquals(DaemonState.STOPPED, daemon.state());
        assertFalse(DataDirLock.isHeld(dataDir), "lock released on stop");
        assertEquals(0, daemon.buffer().size(), "stop drains the buffer to disk");
        assertFalse(daemon.store().files().isEmpty());
    }

    @Test
    void secondDaemonOnSameDirectoryFailsToStart() {
        SamplerDaemon first = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        first.start();

        SamplerDaemon second = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        assertThrows(SamplerDaemon.DaemonStartException.class, second::start);
        assertEquals(DaemonState.STOPPED, second.state());
        assertEquals(DaemonState.RUNNING, first.state());
    }

    @Test
    void startTwiceIsRejected() {
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        daemon.start();
        assertThrows(SamplerDaemon.DaemonStartException.class, daemon::start);
    }

    @Test
    void directoryIsReusableAfterStop() {
        SamplerDaemon first = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        first.start();
        first.stop();

        SamplerDaemon second = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        second.start();
        assertEquals(DaemonState.RUNNING, second.state());
    }

    @Test
    void failingTickDoesNotStopTheLoop() throws Exception {
        FakeMetricsSource source = new FakeMetricsSource();
        source.failWith = new IllegalStateException("sensor unavailable");
        SamplerDaemon daemon = daemon(config(), source, Clock.systemUTC());
        daemon.start();

        waitFor(() -> source.calls.get() >= 3);
        assertEquals(DaemonState.RUNNING, daemon.state());

        source.failWith = null;
        waitFor(() -> daemon.status().samplesTaken() >= 2);
        assertEquals(DaemonState.RUNNING, daemon.state());
    }

    @Test
    void unexpectedLoopFailureCrashesAndRecoverAllowsRestart() throws Exception {
        FakeMetricsSource source = new FakeMetricsSource();
        source.crashWith = new AssertionError("corrupted state");
        SamplerDaemon daemon = daemon(config(), source, Clock.systemUTC());
        daemon.start();

        waitFor(() -> daemon.state() == DaemonState.CRASHED);
        assertFalse(DataDirLock.isHeld(dataDir), "crash releases the lock");
        assertThrows(SamplerDaemon.DaemonStartException.class, daemon::start);

        daemon.recover();
        assertEquals(DaemonState.STOPPED, daemon.state());

        source.crashWith = null;
        daemon.start();
        assertEquals(DaemonState.RUNNING, daemon.state());
    }

    @Test
    void recoverRequiresCrashedState() {
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        assertThrows(IllegalStateException.class, daemon::recover);
    }

    @Test
    void thresholdBreachesRaiseAlerts() {
        FakeMetricsSource source = new FakeMetricsSource();
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        SamplerDaemon daemon = daemon(config(), source, clock);

        assertTrue(daemon.tick());
        assertEquals(0, daemon.status().alertsRaised());

        source.cpuPercent = 95.0;
        clock.advanceMillis(1000);
        daemon.tick();
        assertEquals(1, daemon.status().alertsRaised());

        source.memoryPercent = 91.0;
        clock.advanceMillis(1000);
        daemon.tick();
        assertEquals(3, daemon.status().alertsRaised());
    }

    @Test
    void sampleTimestampsStrictlyIncreaseEvenWhenClockStalls() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), clock);

        daemon.tick();
        daemon.tick();
        daemon.tick();

        List<SystemSample> samples = daemon.buffer().drain();
        assertEquals(3, samples.size());
        assertTrue(samples.get(0).timestampMs() < samples.get(1).timestampMs());
        assertTrue(samples.get(1).timestampMs() < samples.get(2).timestampMs());
    }

    @Test
    void failedFlushKeepsSamplesInBuffer() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        Path blocked = dataDir.resolve("not-a-dir");
        Files.writeString(blocked, "file in the way");
        SamplerDaemon daemon = daemon(config().setDataDir(blocked), new FakeMetricsSource(), clock);

        daemon.tick();
        clock.advanceMillis(1000);
        daemon.tick();

        List<SystemSample> batch = daemon.buffer().drain();
        assertFalse(daemon.flush(batch));
        assertEquals(2, daemon.buffer().size());
    }

    @Test
    void statusFileIsWrittenByFlushNotBySampling() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), clock);
        Path statusFile = dataDir.resolve(DaemonStatus.STATUS_FILE);

        daemon.tick();
        clock.advanceMillis(1_000);
        daemon.tick();

        assertFalse(Files.exists(statusFile));
        assertEquals(2, daemon.status().samplesTaken());
        assertEquals("2024-06-10T00:00:01Z", daemon.status().lastSampleTime());

        daemon.flush(daemon.buffer().drain());

        DaemonStatus persisted = DaemonStatus.readFrom(dataDir);
        assertEquals(2, persisted.samplesTaken());
        assertEquals("2024-06-10T00:00:01Z", persisted.lastFlushTime());
        assertEquals(1, persisted.metricFiles());
    }

    @Test
    void flushWritesOneFileNamedAfterItsTimeRange() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), clock);
        long first = clock.millis();
        daemon.tick();
        clock.advanceMillis(1_000);
        daemon.tick();

        assertTrue(daemon.flush(daemon.buffer().drain()));

        List<MetricFileStore.MetricFile> files = daemon.store().files();
        assertEquals(1, files.size());
        assertEquals(first, files.get(0).firstMs());
        assertEquals(first + 1_000, files.get(0).lastMs());
        assertEquals(0, daemon.buffer().size());
    }

    @Test
    void retentionPruneDeletesOnlyExpiredFiles() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-10T00:00:00Z"));
        SamplerDaemon daemon = daemon(config().setDataRetentionHours(1), new FakeMetricsSource(), clock);
        long now = clock.millis();
        MetricFileStore store = daemon.store();
        store.write(List.of(sample(now - 3 * 3_600_000L), sample(now - 2 * 3_600_000L)));
        store.write(List.of(sample(now - 2 * 3_600_000L + 1000), sample(now - 30 * 60_000L)));

        MetricFileStore.PruneResult result = daemon.prune();

        assertEquals(1, result.deleted());
        assertEquals(1, store.files().size(), "straddling file is kept");
    }

    @Test
    void scheduleFlushCanRunAgainOnceThePreviousFinished() throws Exception {
        SamplerDaemon daemon = daemon(config().setFlushInterval(3600), new FakeMetricsSource(), Clock.systemUTC());
        daemon.start();
        Future<?> first = daemon.scheduleFlush();
        Future<?> second = daemon.scheduleFlush();
        assertNotNull(first);
        first.get();
        if (second != null) second.get();
        assertNotNull(daemon.scheduleFlush());
    }

    @Test
    void staticStatusReportsRunningThenStopped() throws Exception {
        SamplerDaemon daemon = daemon(config(), new FakeMetricsSource(), Clock.systemUTC());
        daemon.start();

        DaemonStatus running = SamplerDaemon.status(dataDir);
        assertTrue(running.running());
        assertEquals(DaemonState.RUNNING, running.state());
        assertEquals(ProcessHandle.current().pid(), running.pid());

        daemon.stop();
        DaemonStatus stopped = SamplerDaemon.status(dataDir);
        assertFalse(stopped.running());
        assertEquals(DaemonState.STOPPED, stopped.state());
    }

    @Test
    void staleRunningStatusWithoutLockIsReportedCrashed() throws IOException {
        DaemonStatus stale = new DaemonStatus(DaemonState.RUNNING, true, 999_999, dataDir.toString(),
            null, null, null, 10, 0, 0, 1);
        stale.writeTo(dataDir);

        DaemonStatus status = SamplerDaemon.status(dataDir);
        assertEquals(DaemonState.CRASHED, status.state());
        assertFalse(status.running());
    }

    @Test
    void statusWithoutAnyFilesIsStopped() throws IOException {
        DaemonStatus status = SamplerDaemon.status(dataDir);
        assertEquals(DaemonState.STOPPED, status.state());
        assertFalse(status.running());
    }

    private static SystemSample sample(long ts) {
        return new SystemSample(ts, Instant.ofEpochMilli(ts).toString(), 1.0, 2.0, 3L, 4L, null, null);
    }
}
