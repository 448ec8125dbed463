package com.callperf.agent.upload;

import java.util.Locale;

/** When the aggregation store is flushed to its sink. */
public enum UploadStrategy {
    /** Once, when the session is closed. */
    ON_EXIT,
    /** After every stored record. */
    REAL_TIME,
    /** When the store reaches the batch size or the batch interval elapsed, whichever first. */
    BATCH,
    /** Only when the host calls flush. */
    MANUAL;

    /** Parses the configuration spelling ("on_exit", "real_time", "batch", "manual"). */
    public static UploadStrategy parse(String value) {
        if (value == null || value.isBlank()) return ON_EXIT;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown upload strategy: " + value, e);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
