package com.callperf.agent.upload;

import java.time.Instant;

/**
 * Identity of one instrumentation session.
 *
 * @param sessionId random identifier generated when the session starts
 * @param hostname  host the session runs on
 * @param startTime when the session started
 */
public record SessionInfo(String sessionId, String hostname, Instant startTime) {}
