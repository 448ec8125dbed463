package com.callperf.daemon;

/**
 * Sampler lifecycle. STOPPED → STARTING → RUNNING → STOPPING → STOPPED; any state may move
 * to CRASHED on an unexpected loop failure, and CRASHED returns to STOPPED only through
 * {@link SamplerDaemon#recover()}.
 */
public enum DaemonState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    CRASHED
}
