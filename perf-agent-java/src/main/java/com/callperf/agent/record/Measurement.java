package com.callperf.agent.record;

import java.util.List;
import java.util.Map;

/**
 * One in-flight measurement, opened by {@link CallRecorder#start} and completed by
 * {@link #close()}. Intended for try-with-resources so completion happens on every exit path:
 *
 * <pre>{@code
 * try (Measurement m = recorder.start("com.shop.Checkout.total")) {
 *     return computeTotal();
 * }
 * }</pre>
 *
 * Not thread-safe; open and close it on the same thread.
 */
public final class Measurement implements AutoCloseable {

    static final Measurement NOOP = new Measurement(null, null, 0, 0, null);

    private final CallRecorder recorder;
    private final String qualifiedName;
    private final long wallStart;
    private final long cpuStart;
    private final List<Map<String, String>> arguments;
    private String thrown;
    private boolean closed;

    Measurement(CallRecorder recorder, String qualifiedName, long wallStart, long cpuStart,
                List<Map<String, String>> arguments) {
        this.recorder = recorder;
        this.qualifiedName = qualifiedName;
        this.wallStart = wallStart;
        this.cpuStart = cpuStart;
        this.arguments = arguments;
    }

    /** Marks the measured block as having exited with {@code error}. */
    public Measurement failed(Throwable error) {
        if (recorder != null && error != null) {
            thrown = error.getClass().getSimpleName();
        }
        return this;
    }

    /** True for measurements that will never produce a record (disabled or filtered). */
    public boolean isNoop() {
        return recorder == null;
    }

    String qualifiedName() { return qualifiedName; }
    long wallStart()       { return wallStart; }
    long cpuStart()        { return cpuStart; }
    List<Map<String, String>> arguments() { return arguments; }
    String thrown()        { return thrown; }

    @Override
    public void close() {
        if (recorder == null || closed) return;
        closed = true;
        recorder.complete(this);
    }
}
