package com.callperf.agent.upload;

import java.time.Duration;

/** Waits between retries. Replaced in tests to avoid real sleeping. */
@FunctionalInterface
public interface Sleeper {

    /** Returns false if the wait was interrupted and the caller should stop retrying. */
    boolean sleep(Duration duration);

    Sleeper SYSTEM = duration -> {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    };
}
