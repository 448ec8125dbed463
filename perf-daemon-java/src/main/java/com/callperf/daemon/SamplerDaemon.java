package com.callperf.daemon;

import com.callperf.daemon.sample.OsMetricsSource;
import com.callperf.daemon.sample.SystemMetricsSource;
import com.callperf.daemon.sample.SystemSample;
import com.callperf.daemon.store.DataDirLock;
import com.callperf.daemon.store.MetricFileStore;
import com.callperf.daemon.store.SampleRingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples system resources at a fixed interval into a bounded buffer and periodically
 * flushes the buffer to metric files. One daemon per data directory, enforced by
 * {@link DataDirLock}.
 *
 * Sampling runs on one loop thread. Flushes run on a single worker thread, and a flush
 * that is still in progress when the next one falls due causes that one to be skipped, so
 * slow disks never delay a tick. The status file is persisted from the flush worker and on
 * state changes; {@link #status()} is always current.
 */
public class SamplerDaemon {

    private static final Logger log = LoggerFactory.getLogger(SamplerDaemon.class);

    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    private final DaemonConfig config;
    private final SystemMetricsSource source;
    private final Clock clock;
    private final Path dataDir;
    private final SampleRingBuffer buffer;
    private final MetricFileStore store;

    private volatile DaemonState state = DaemonState.STOPPED;
    private final AtomicBoolean flushing = new AtomicBoolean();
    private final AtomicLong samplesTaken = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();
    // the flush worker and state changes both persist status; the last writer must see the latest state
    private final Object statusWrite = new Object();

    private DataDirLock lock;
    private ExecutorService flushWorker;
    private volatile CountDownLatch stopSignal;
    private volatile Thread loopThread;

    private volatile Instant startedAt;
    private volatile Instant lastSample;
    private volatile Instant lastFlush;
    private volatile int metricFiles;
    /** Loop thread only. */
    private long lastTimestamp = Long.MIN_VALUE;

    public SamplerDaemon(DaemonConfig config) {
        this(config, new OsMetricsSource(config.isCollectNetwork(), config.getTrackProcesses()), Clock.systemUTC());
    }

    public SamplerDaemon(DaemonConfig config, SystemMetricsSource source, Clock clock) {
        this.config = config;
        this.source = source;
        this.clock = clock;
        this.dataDir = config.getDataDir();
        this.buffer = new SampleRingBuffer(config.getBufferCapacity());
        this.store = new MetricFileStore(dataDir);
    }

    /**
     * Takes the data directory lock and starts the sampling loop.
     *
     * @throws DaemonStartException if the daemon is not STOPPED or the lock is unavailable
     */
    public synchronized void start() {
        if (state != DaemonState.STOPPED) {
            throw new DaemonStartException("Cannot start sampler in state " + state);
        }
        state = DaemonState.STARTING;
        try {
            lock = DataDirLock.acquire(dataDir);
        } catch (IOException e) {
            state = DaemonState.STOPPED;
            throw new DaemonStartException(e.getMessage(), e);
        }

        flushWorker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "callperf-flush");
            t.setDaemon(true);
            return t;
        });
        stopSignal = new CountDownLatch(1);
        startedAt = clock.instant();
        refreshFileCount();

        state = DaemonState.RUNNING;
        writeStatus();
        Thread thread = new Thread(this::loop, "callperf-sampler");
        loopThread = thread;
        thread.start();
        log.info("Sampler started on {} (interval {} ms, flush every {} ms)", dataDir,
            config.getSampleInterval().toMillis(), config.getFlushInterval().toMillis());
    }

    /**
     * Asks the loop to finish its current tick, flush what is buffered, and release the lock.
     * Blocks until that has happened unless called from the loop thread itself.
     */
    public void stop() {
        CountDownLatch signal = stopSignal;
        Thread thread = loopThread;
        if (signal == null || thread == null) return;
        synchronized (this) {
            if (state == DaemonState.RUNNING) state = DaemonState.STOPPING;
        }
        signal.countDown();
        if (Thread.currentThread() != thread) {
            awaitTermination();
        }
    }

    /** Blocks until the sampling loop has exited. */
    public void awaitTermination() {
        Thread thread = loopThread;
        if (thread == null) return;
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Moves a crashed daemon back to STOPPED so it can be started again. */
    public synchronized void recover() {
        if (state != DaemonState.CRASHED) {
            throw new IllegalStateException("Only a crashed sampler can be recovered, state is " + state);
        }
        state = DaemonState.STOPPED;
        log.info("Sampler recovered from crash");
    }

    public DaemonState state() { return state; }

    public DaemonStatus status() {
        return new DaemonStatus(state, state == DaemonState.RUNNING || state == DaemonState.STOPPING,
            ProcessHandle.current().pid(), dataDir.toString(), text(startedAt), text(lastSample),
            text(lastFlush), samplesTaken.get(), buffer.size(), alertsRaised.get(), metricFiles);
    }

    /**
     * Status of whatever daemon owns {@code dataDir}, read from its status file. A file that
     * claims a running daemon while nobody holds the lock means that daemon died without
     * cleaning up, and is reported as CRASHED.
     */
    public static DaemonStatus status(Path dataDir) throws IOException {
        DaemonStatus recorded = DaemonStatus.readFrom(dataDir);
        boolean held = DataDirLock.isHeld(dataDir);
        if (recorded == null) {
            return new DaemonStatus(held ? DaemonState.RUNNING : DaemonState.STOPPED, held,
                DataDirLock.readPid(dataDir).orElse(-1), dataDir.toString(), null, null, null, 0, 0, 0, 0);
        }
        if (recorded.running() && !held) {
            return recorded.withState(DaemonState.CRASHED, false);
        }
        return recorded;
    }

    private void loop() {
        try {
            long interval = config.getSampleInterval().toMillis();
            long flushEvery = config.getFlushInterval().toMillis();
            long next = clock.millis();
            long nextFlush = next + flushEvery;
            boolean stopping = false;
            while (!stopping) {
                tick();
                long now = clock.millis();
                if (now >= nextFlush) {
                    scheduleFlush();
                    nextFlush = now + flushEvery;
                }
                next += interval;
                if (next <= now) {
                    // behind schedule: skip the missed ticks rather than bursting
                    next = now + interval;
                }
                stopping = stopSignal.await(next - now, TimeUnit.MILLISECONDS);
            }
            drainAndStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drainAndStop();
        } catch (RuntimeException | Error e) {
            log.error("Sampler loop crashed", e);
            crash();
        }
    }

    /**
     * Takes one sample. Failures are logged and do not stop the loop. Nothing here touches the
     * disk; the status file is written by flushes and state changes.
     */
    boolean tick() {
        try {
            long ts = clock.millis();
            if (ts <= lastTimestamp) ts = lastTimestamp + 1;
            SystemSample sample = source.sample(ts);
            if (sample.timestampMs() != ts) sample = sample.withTimestamp(ts);
            buffer.add(sample);
            lastTimestamp = ts;
            samplesTaken.incrementAndGet();
            lastSample = Instant.ofEpochMilli(ts);
            checkThresholds(sample);
            return true;
        } catch (RuntimeException e) {
            log.warn("Sample failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private void checkThresholds(SystemSample sample) {
        if (sample.cpuPercent() > config.getCpuThreshold()) {
            alertsRaised.incrementAndGet();
            log.warn("CPU usage {}% above threshold {}%", sample.cpuPercent(), config.getCpuThreshold());
        }
        if (sample.memoryPercent() > config.getMemoryThreshold()) {
            alertsRaised.incrementAndGet();
            log.warn("Memory usage {}% above threshold {}%", sample.memoryPercent(), config.getMemoryThreshold());
        }
    }

    /**
     * Hands the buffered samples to the flush worker.
     *
     * @return the flush task, or null if one was already in progress
     */
    Future<?> scheduleFlush() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Previous flush still running, skipping this one");
            return null;
        }
        List<SystemSample> batch = buffer.drain();
        try {
            return flushWorker.submit(() -> {
                try {
                    flush(batch);
                } finally {
                    flushing.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            buffer.requeueFront(batch);
            flushing.set(false);
            return null;
        }
    }

    /**
     * Writes a batch, prunes expired files and persists the status. A failed write puts the
     * batch back in the buffer.
     */
    boolean flush(List<SystemSample> batch) {
        boolean written = true;
        if (!batch.isEmpty()) {
            try {
                store.write(batch);
                lastFlush = clock.instant();
            } catch (IOException | RuntimeException e) {
                written = false;
                buffer.requeueFront(batch);
                log.warn("Metric flush of {} samples failed, kept in buffer: {}", batch.size(), e.getMessage());
            }
        }
        prune();
        writeStatus();
        return written;
    }

    MetricFileStore.PruneResult prune() {
        long cutoff = clock.millis() - config.getRetention().toMillis();
        try {
            MetricFileStore.PruneResult result = store.prune(cutoff);
            refreshFileCount();
            return result;
        } catch (IOException e) {
            log.warn("Retention prune failed: {}", e.getMessage());
            return new MetricFileStore.PruneResult(0, 0);
        }
    }

    private void drainAndStop() {
        state = DaemonState.STOPPING;
        flushWorker.shutdown();
        try {
            if (!flushWorker.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("In-flight flush did not finish within {}s", DRAIN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        flush(buffer.drain());
        releaseLock();
        synchronized (this) {
            state = DaemonState.STOPPED;
        }
        writeStatus();
        log.info("Sampler stopped after {} samples", samplesTaken.get());
    }

    private void crash() {
        flushWorker.shutdownNow();
        releaseLock();
        synchronized (this) {
            state = DaemonState.CRASHED;
        }
        writeStatus();
    }

    private void releaseLock() {
        DataDirLock held = lock;
        lock = null;
        if (held == null) return;
        try {
            held.close();
        } catch (IOException e) {
            log.warn("Failed to release data directory lock: {}", e.getMessage());
        }
    }

    private void refreshFileCount() {
        try {
            metricFiles = store.files().size();
        } catch (IOException e) {
            log.debug("Cannot list metric files: {}", e.getMessage());
        }
    }

    private void writeStatus() {
        synchronized (statusWrite) {
            try {
                status().writeTo(dataDir);
            } catch (IOException e) {
                log.debug("Cannot write status file: {}", e.getMessage());
            }
        }
    }

    SampleRingBuffer buffer() { return buffer; }

    MetricFileStore store() { return store; }

    private static String text(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    public static class DaemonStartException extends RuntimeException {
        public DaemonStartException(String message) { super(message); }
        public DaemonStartException(String message, Throwable cause) { super(message, cause); }
    }
}
