package com.callperf.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes a {@link PerfSession} on JVM shutdown so its final flush runs.
 * Registered via {@link PerfSession#registerShutdownHook()}.
 */
public class SessionShutdownHook implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SessionShutdownHook.class);

    private final PerfSession session;

    public SessionShutdownHook(PerfSession session) {
        this.session = session;
    }

    @Override
    public void run() {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.error("Final flush of session {} failed: {}", session.sessionId(), e.getMessage(), e);
        }
    }
}
