package com.callperf.agent.upload;

/** Result of one flush attempt as seen by the host. */
public enum FlushOutcome {
    /** The store was empty; nothing was written. */
    EMPTY,
    /** The primary sink acknowledged the batch. */
    DELIVERED,
    /** Retries were exhausted and the batch went to the local fallback sink. */
    FALLBACK,
    /** The primary sink rejected the batch permanently; it was discarded. */
    DROPPED,
    /** Neither sink took the batch; its records stay in the store for the next flush. */
    FAILED,
    /** Requested from inside a running delivery on the same thread; left to the next flush. */
    SKIPPED
}
