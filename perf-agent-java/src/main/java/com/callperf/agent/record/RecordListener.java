package com.callperf.agent.record;

/** Notified after a record was stored. */
@FunctionalInterface
public interface RecordListener {

    void onRecorded(CallRecord record);

    RecordListener NONE = record -> {};
}
