package com.callperf.agent;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.correlate.CorrelationReport;
import com.callperf.agent.correlate.Correlator;
import com.callperf.agent.record.CallRecorder;
import com.callperf.agent.record.ClockSource;
import com.callperf.agent.record.Measurement;
import com.callperf.agent.record.SystemClockSource;
import com.callperf.agent.sink.Sink;
import com.callperf.agent.sink.SinkFactory;
import com.callperf.agent.store.AggregationStore;
import com.callperf.agent.store.FunctionSummary;
import com.callperf.agent.upload.FlushOutcome;
import com.callperf.agent.upload.SessionInfo;
import com.callperf.agent.upload.Sleeper;
import com.callperf.agent.upload.UploadController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.SortedMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One process lifetime of instrumentation: owns the aggregation store, the recorder feeding it
 * and the upload controller draining it.
 *
 * Call sites hold the session (or its {@link #recorder()}) explicitly. Closing the session runs
 * the final flush exactly once; hosts without a reliable exit path can ask for a JVM shutdown
 * hook with {@link #registerShutdownHook()}.
 *
 * <pre>{@code
 * try (PerfSession perf = PerfSession.open(config)) {
 *     perf.recorder().time("com.shop.Checkout.total", () -> checkout.total(cart));
 * }
 * }</pre>
 */
public final class PerfSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PerfSession.class);

    private final PerfConfig config;
    private final SessionInfo info;
    private final Clock clock;
    private final AggregationStore store;
    private final UploadController controller;
    private final CallRecorder recorder;
    private final AtomicBoolean closed = new AtomicBoolean();

    private PerfSession(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.info = new SessionInfo(UUID.randomUUID().toString(), b.hostname, clock.instant());
        this.store = new AggregationStore();
        Sink primary = b.primary != null ? b.primary : SinkFactory.primary(config);
        Sink fallback = b.fallback != null ? b.fallback : SinkFactory.fallback(config);
        this.controller = new UploadController(config, store, primary, fallback, info, clock, b.sleeper);
        this.recorder = new CallRecorder(config, b.clockSource, store, controller);
        log.info("Started session {} on {} (strategy={}, sink={})",
            info.sessionId(), info.hostname(), controller.strategy().configName(), primary.name());
    }

    /** Opens a session with sinks built from {@code config}. */
    public static PerfSession open(PerfConfig config) {
        return builder(config).build();
    }

    public static Builder builder(PerfConfig config) {
        return new Builder(config);
    }

    public SessionInfo info()                { return info; }
    public String sessionId()                { return info.sessionId(); }
    public PerfConfig config()               { return config; }
    public AggregationStore store()          { return store; }
    public CallRecorder recorder()           { return recorder; }
    public UploadController uploadController() { return controller; }

    // -----------------------------------------------------------------------
    // Convenience pass-throughs
    // -----------------------------------------------------------------------

    public Measurement start(String qualifiedName, Object... args) {
        return recorder.start(qualifiedName, args);
    }

    public <T, E extends Exception> T time(String qualifiedName, CallRecorder.ThrowingSupplier<T, E> body) throws E {
        return recorder.time(qualifiedName, body);
    }

    public FunctionSummary summary(String qualifiedName) {
        return store.summary(qualifiedName);
    }

    public SortedMap<String, FunctionSummary> summaries() {
        return store.summaries();
    }

    public FlushOutcome flush() {
        return controller.flush();
    }

    public void tick() {
        controller.tick();
    }

    /**
     * Joins this session's records, from session start until now, with the sampler data in
     * {@code samplerDataDir}. Load fields are absent when the sampler has no data there.
     */
    public CorrelationReport correlationReport(Path samplerDataDir) {
        return new Correlator(samplerDataDir).correlate(store, info.startTime(), clock.instant());
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /** Registers a JVM shutdown hook that closes this session. */
    public PerfSession registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(new SessionShutdownHook(this), "callperf-shutdown"));
        return this;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops recording, then runs the final flush according to the upload strategy. Idempotent.
     * Calls made through the recorder afterwards run uninstrumented.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        recorder.stop();
        controller.close();
        log.info("Closed session {} ({} calls tracked, {} unflushed)",
            info.sessionId(), recorder.trackedCalls(), store.size());
    }

    // -----------------------------------------------------------------------
    // Builder
    // -----------------------------------------------------------------------

    public static final class Builder {
        private final PerfConfig config;
        private ClockSource clockSource = new SystemClockSource();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Sink primary;
        private Sink fallback;
        private String hostname = localHostname();

        private Builder(PerfConfig config) {
            this.config = config != null ? config : PerfConfig.defaults();
        }

        public Builder clockSource(ClockSource clockSource) { this.clockSource = clockSource; return this; }
        public Builder clock(Clock clock)                   { this.clock = clock; return this; }
        public Builder sleeper(Sleeper sleeper)             { this.sleeper = sleeper; return this; }
        public Builder primarySink(Sink sink)               { this.primary = sink; return this; }
        public Builder fallbackSink(Sink sink)              { this.fallback = sink; return this; }
        public Builder hostname(String hostname)            { this.hostname = hostname; return this; }

        public PerfSession build() {
            return new PerfSession(this);
        }

        private static String localHostname() {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                return "unknown";
            }
        }
    }
}
