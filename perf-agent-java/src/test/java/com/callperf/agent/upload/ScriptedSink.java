package com.callperf.agent.upload;

import com.callperf.agent.record.CallRecord;
import com.callperf.agent.sink.FlushMetadata;
import com.callperf.agent.sink.Sink;
import com.callperf.agent.sink.SinkResult;
import com.callperf.agent.store.AggregationStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Sink that fails according to a script, then accepts everything. */
class ScriptedSink implements Sink {

    private final String name;
    final Deque<RuntimeException> failures = new ArrayDeque<>();
    final List<List<CallRecord>> delivered = new ArrayList<>();
    final List<FlushMetadata> metadata = new ArrayList<>();
    int attempts;
    boolean alwaysFail;
    int closeCalls;
    /** When set, the store size seen at each attempt is kept in {@link #storeSizes}. */
    AggregationStore observed;
    final List<Integer> storeSizes = new ArrayList<>();
    /** Runs once, inside the next write, before the sink decides its outcome. */
    Runnable duringWrite;

    ScriptedSink(String name) {
        this.name = name;
    }

    ScriptedSink failWith(RuntimeException e) {
        failures.add(e);
        return this;
    }

    @Override
    public SinkResult write(String sessionId, List<CallRecord> records, FlushMetadata meta) {
        attempts++;
        Runnable hook = duringWrite;
        duringWrite = null;
        if (hook != null) hook.run();
        if (observed != null) storeSizes.add(observed.size());
        if (alwaysFail) throw new IllegalStateException(name + " is down");
        RuntimeException failure = failures.poll();
        if (failure != null) throw failure;
        delivered.add(List.copyOf(records));
        metadata.add(meta);
        return new SinkResult(name + "#" + delivered.size(), records.size());
    }

    int deliveredRecords() {
        return delivered.stream().mapToInt(List::size).sum();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        closeCalls++;
    }
}
