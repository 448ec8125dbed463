package com.callperf.agent.sink;

import java.time.Instant;

/**
 * Session context written alongside a batch.
 *
 * @param hostname     host the session runs on
 * @param sessionStart when the session started
 * @param flushTime    when this flush was initiated
 * @param reason       what triggered the flush, e.g. "on_exit", "batch_size"
 */
public record FlushMetadata(String hostname, Instant sessionStart, Instant flushTime, String reason) {}
