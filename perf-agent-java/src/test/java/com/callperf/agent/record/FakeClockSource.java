package com.callperf.agent.record;

import java.time.Instant;

/** Clock the test advances by hand. Each {@link #advance} moves wall and CPU time together. */
public class FakeClockSource implements ClockSource {

    private long wall;
    private long cpu;
    private Instant now = Instant.parse("2024-06-10T12:00:00Z");
    private boolean failing;

    public void advance(double wallSeconds, double cpuSeconds) {
        wall += Math.round(wallSeconds * 1_000_000_000L);
        cpu += Math.round(cpuSeconds * 1_000_000_000L);
        now = now.plusNanos(Math.round(wallSeconds * 1_000_000_000L));
    }

    public void advance(double seconds) {
        advance(seconds, seconds);
    }

    public void setNow(Instant now) {
        this.now = now;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public long wallNanos() {
        if (failing) throw new MeasurementFailure("clock unavailable");
        return wall;
    }

    @Override
    public long cpuNanos() {
        if (failing) throw new MeasurementFailure("clock unavailable");
        return cpu;
    }

    @Override
    public Instant now() {
        return now;
    }
}
