package com.callperf.agent.sink;

import com.callperf.agent.record.CallRecord;

import java.util.List;

/**
 * A persistence or upload destination for flushed call records.
 *
 * A returned result means the batch is durable at the destination. Failures are reported as
 * {@link TransientDeliveryException} when retrying may succeed and as
 * {@link PermanentDeliveryException} when it cannot.
 */
public interface Sink extends AutoCloseable {

    SinkResult write(String sessionId, List<CallRecord> records, FlushMetadata metadata);

    /** Short name for log messages. */
    String name();

    /** Releases clients or handles held by the sink. */
    @Override
    default void close() {}
}
