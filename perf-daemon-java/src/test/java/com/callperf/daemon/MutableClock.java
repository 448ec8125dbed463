package com.callperf.daemon;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

class MutableClock extends Clock {

    private volatile Instant now;

    MutableClock(Instant start) { this.now = start; }

    void advanceMillis(long millis) { now = now.plusMillis(millis); }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }
    @Override public Clock withZone(ZoneId zone) { return this; }
    @Override public Instant instant() { return now; }
}
