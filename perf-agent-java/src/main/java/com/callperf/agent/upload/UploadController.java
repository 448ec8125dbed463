package com.callperf.agent.upload;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.record.CallRecord;
import com.callperf.agent.record.RecordListener;
import com.callperf.agent.sink.*;
import com.callperf.agent.store.AggregationStore;
import com.callperf.agent.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when the aggregation store is flushed and delivers each flush.
 *
 * Delivery: the primary sink is tried once plus up to {@code retryAttempts} retries while it
 * reports transient failures, with {@link RetryBackoff} between attempts. A batch that still
 * fails goes to the fallback sink. A permanent failure drops the batch. Flushed records are
 * removed from the store only after a sink acknowledged them; nothing here ever throws to the
 * host. Calls recorded by a sink while it delivers stay in the store and never start a nested
 * flush. The batch interval is checked lazily on each record and on {@link #tick()}; no timer
 * thread is started.
 */
public class UploadController implements RecordListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UploadController.class);

    private final UploadStrategy strategy;
    private final int batchSize;
    private final Duration batchInterval;
    private final int retryAttempts;
    private final boolean debug;

    private final AggregationStore store;
    private final Sink primary;
    private final Sink fallback;
    private final SessionInfo session;
    private final Clock clock;
    private final Sleeper sleeper;

    private final AtomicBoolean closed = new AtomicBoolean();
    // set while this thread is inside flush(reason); sinks may run instrumented code
    private final ThreadLocal<Boolean> delivering = ThreadLocal.withInitial(() -> Boolean.FALSE);
    private volatile Instant lastFlush;

    public UploadController(PerfConfig config, AggregationStore store, Sink primary, Sink fallback,
                            SessionInfo session, Clock clock, Sleeper sleeper) {
        this.strategy = UploadStrategy.parse(config.upload().getStrategy());
        this.batchSize = Math.max(1, config.upload().getBatchSize());
        this.batchInterval = config.upload().getBatchInterval();
        this.retryAttempts = Math.max(0, config.upload().getRetryAttempts());
        this.debug = config.core().isDebug();
        this.store = store;
        this.primary = primary;
        this.fallback = fallback;
        this.session = session;
        this.clock = clock;
        this.sleeper = sleeper;
        this.lastFlush = clock.instant();
    }

    public UploadStrategy strategy() {
        return strategy;
    }

    // -----------------------------------------------------------------------
    // Triggers
    // -----------------------------------------------------------------------

    @Override
    public void onRecorded(CallRecord record) {
        switch (strategy) {
            case REAL_TIME -> flush("real_time");
            case BATCH     -> flushIfDue();
            default        -> { }
        }
    }

    /** Lets the host check the batch interval without recording a call. */
    public void tick() {
        if (strategy == UploadStrategy.BATCH) {
            flushIfDue();
        }
    }

    /** Flushes now, regardless of strategy. */
    public FlushOutcome flush() {
        return flush("manual");
    }

    private synchronized void flushIfDue() {
        if (store.size() >= batchSize) {
            flush("batch_size");
        } else if (!store.isEmpty() && !clock.instant().isBefore(lastFlush.plus(batchInterval))) {
            flush("batch_interval");
        }
    }

    /**
     * Final flush at session end. Runs at most once; for {@link UploadStrategy#MANUAL} nothing is
     * flushed. Sinks are closed afterwards.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            if (strategy != UploadStrategy.MANUAL) {
                flush("on_exit");
            }
        } finally {
            closeQuietly(primary);
            if (fallback != primary) closeQuietly(fallback);
        }
    }

    // -----------------------------------------------------------------------
    // Delivery
    // -----------------------------------------------------------------------

    synchronized FlushOutcome flush(String reason) {
        if (delivering.get()) {
            log.debug("Ignoring {} flush requested during delivery", reason);
            return FlushOutcome.SKIPPED;
        }
        delivering.set(Boolean.TRUE);
        try {
            StoreSnapshot snapshot = store.snapshot();
            if (snapshot.isEmpty()) {
                return FlushOutcome.EMPTY;
            }
            lastFlush = clock.instant();
            List<CallRecord> records = snapshot.records();
            FlushMetadata metadata = new FlushMetadata(session.hostname(), session.startTime(), lastFlush, reason);
            if (debug) {
                log.info("Flushing {} records to {} ({})", records.size(), primary.name(), reason);
            } else {
                log.debug("Flushing {} records to {} ({})", records.size(), primary.name(), reason);
            }

            for (int attempt = 0; ; attempt++) {
                try {
                    SinkResult result = primary.write(session.sessionId(), records, metadata);
                    store.remove(snapshot);
                    log.debug("Delivered {} records to {}", result.recordCount(), result.location());
                    return FlushOutcome.DELIVERED;
                } catch (PermanentDeliveryException e) {
                    store.remove(snapshot);
                    log.error("Dropping {} records: {} rejected them permanently: {}",
                        records.size(), primary.name(), e.getMessage());
                    return FlushOutcome.DROPPED;
                } catch (RuntimeException e) {
                    if (attempt >= retryAttempts) {
                        log.warn("Delivery to {} failed after {} attempts: {}",
                            primary.name(), attempt + 1, e.getMessage());
                        break;
                    }
                    Duration delay = RetryBackoff.next(attempt);
                    log.warn("Delivery to {} failed (attempt {}/{}), retrying in {} ms: {}",
                        primary.name(), attempt + 1, retryAttempts + 1, delay.toMillis(), e.getMessage());
                    if (!sleeper.sleep(delay)) {
                        log.warn("Interrupted while waiting to retry delivery to {}", primary.name());
                        break;
                    }
                }
            }
            return deliverToFallback(snapshot, records, metadata);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while flushing: {}", e.toString(), e);
            return FlushOutcome.FAILED;
        } finally {
            delivering.remove();
        }
    }

    private FlushOutcome deliverToFallback(StoreSnapshot snapshot, List<CallRecord> records, FlushMetadata metadata) {
        if (fallback == null || fallback == primary) {
            log.error("{} records kept in memory: no fallback sink available", records.size());
            return FlushOutcome.FAILED;
        }
        try {
            SinkResult result = fallback.write(session.sessionId(), records, metadata);
            store.remove(snapshot);
            log.warn("Wrote {} undelivered records to fallback {}", result.recordCount(), result.location());
            return FlushOutcome.FALLBACK;
        } catch (RuntimeException e) {
            log.error("Fallback {} also failed, keeping {} records in memory: {}",
                fallback.name(), records.size(), e.getMessage());
            return FlushOutcome.FAILED;
        }
    }

    private static void closeQuietly(Sink sink) {
        if (sink == null) return;
        try {
            sink.close();
        } catch (Exception e) {
            log.warn("Failed to close sink {}: {}", sink.name(), e.getMessage());
        }
    }
}
