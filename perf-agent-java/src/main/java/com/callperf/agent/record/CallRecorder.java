package com.callperf.agent.record;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.store.AggregationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Measures wall and CPU time of instrumented code and stores qualifying calls.
 *
 * Instrumentation is invisible to the measured code: failures inside the recorder are logged
 * and swallowed, while the measured code's own return values and exceptions pass through
 * untouched. A call is stored only when its name passes the {@link CallFilter}, its wall time
 * is at least the configured minimum, and the session's tracked-call cap is not yet reached.
 */
public final class CallRecorder {

    private static final Logger log = LoggerFactory.getLogger(CallRecorder.class);

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    private final ClockSource clock;
    private final AggregationStore store;
    private final RecordListener listener;
    private final CallFilter filter;
    private final boolean enabled;
    private final boolean debug;
    private final double minExecutionTime;
    private final int maxTrackedCalls;
    private final boolean trackArguments;
    private final ArgumentLimits argumentLimits;

    private final AtomicInteger trackedCalls = new AtomicInteger();
    private final AtomicBoolean capReported = new AtomicBoolean();
    private volatile boolean stopped;

    public CallRecorder(PerfConfig config, ClockSource clock, AggregationStore store, RecordListener listener) {
        this.clock = clock;
        this.store = store;
        this.listener = listener != null ? listener : RecordListener.NONE;
        this.filter = new CallFilter(config.filters());
        this.enabled = config.core().isEnabled();
        this.debug = config.core().isDebug();
        this.minExecutionTime = config.core().getMinExecutionTime();
        this.maxTrackedCalls = config.core().getMaxTrackedCalls();
        this.trackArguments = config.filters().isTrackArguments();
        this.argumentLimits = ArgumentLimits.withMaxValueLength(config.filters().getMaxArgumentLength());
    }

    // -----------------------------------------------------------------------
    // Scoped measurement
    // -----------------------------------------------------------------------

    /**
     * Opens a measurement for {@code qualifiedName}. Arguments are captured only when argument
     * tracking is enabled. Never throws.
     */
    public Measurement start(String qualifiedName, Object... args) {
        if (!enabled || stopped || qualifiedName == null) return Measurement.NOOP;
        try {
            if (!filter.accepts(qualifiedName)) return Measurement.NOOP;
            List<Map<String, String>> captured = trackArguments
                ? ArgumentSerializer.serializeAll(args, argumentLimits)
                : null;
            long cpuStart = clock.cpuNanos();
            long wallStart = clock.wallNanos();
            return new Measurement(this, qualifiedName, wallStart, cpuStart, captured);
        } catch (RuntimeException e) {
            log.warn("Measurement of {} could not start, running uninstrumented: {}", qualifiedName, e.toString());
            return Measurement.NOOP;
        }
    }

    void complete(Measurement m) {
        if (stopped) return;
        try {
            long wallEnd = clock.wallNanos();
            long cpuEnd = clock.cpuNanos();
            double wallTime = Math.max(0L, wallEnd - m.wallStart()) / 1_000_000_000.0;
            double cpuTime = Math.max(0L, cpuEnd - m.cpuStart()) / 1_000_000_000.0;

            if (wallTime < minExecutionTime) {
                return;
            }
            if (!reserveSlot()) {
                if (capReported.compareAndSet(false, true)) {
                    log.warn("Tracked call limit of {} reached; further calls are measured but not stored",
                        maxTrackedCalls);
                }
                return;
            }

            CallRecord record = new CallRecord(
                m.qualifiedName(), wallTime, cpuTime, clock.now(), m.arguments(), m.thrown());
            store.record(record);
            if (debug) {
                log.info("Recorded {} wall={}s cpu={}s", record.qualifiedName(), wallTime, cpuTime);
            } else if (log.isTraceEnabled()) {
                log.trace("Recorded {} wall={}s cpu={}s", record.qualifiedName(), wallTime, cpuTime);
            }
            listener.onRecorded(record);
        } catch (RuntimeException e) {
            log.warn("Failed to record call to {}: {}", m.qualifiedName(), e.toString(), e);
        }
    }

    private boolean reserveSlot() {
        while (true) {
            int n = trackedCalls.get();
            if (n >= maxTrackedCalls) return false;
            if (trackedCalls.compareAndSet(n, n + 1)) return true;
        }
    }

    /**
     * Turns the recorder into a pass-through for good. Measurements still open are discarded
     * when they complete.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    /** Records stored so far in this session, including ones already flushed. */
    public int trackedCalls() {
        return trackedCalls.get();
    }

    // -----------------------------------------------------------------------
    // Combinators
    // -----------------------------------------------------------------------

    public <T, E extends Exception> T time(String qualifiedName, ThrowingSupplier<T, E> body) throws E {
        Measurement m = start(qualifiedName);
        try {
            return body.get();
        } catch (RuntimeException | Error e) {
            m.failed(e);
            throw e;
        } catch (Exception e) {
            m.failed(e);
            throw CallRecorder.<E>rethrown(e);
        } finally {
            m.close();
        }
    }

    public <E extends Exception> void run(String qualifiedName, ThrowingRunnable<E> body) throws E {
        time(qualifiedName, () -> {
            body.run();
            return null;
        });
    }

    /** Returns a supplier that measures every invocation of {@code target}. */
    public <T> Supplier<T> wrap(String qualifiedName, Supplier<T> target) {
        return () -> time(qualifiedName, target::get);
    }

    public Runnable wrap(String qualifiedName, Runnable target) {
        return () -> run(qualifiedName, target::run);
    }

    // body can only throw E or unchecked exceptions, so the cast holds
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E rethrown(Exception e) {
        return (E) e;
    }
}
