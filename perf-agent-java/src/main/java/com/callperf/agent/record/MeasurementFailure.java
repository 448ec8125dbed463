package com.callperf.agent.record;

/**
 * A clock or CPU-time read failed. The call it belongs to proceeds uninstrumented.
 */
public class MeasurementFailure extends RuntimeException {
    public MeasurementFailure(String message) { super(message); }
    public MeasurementFailure(String message, Throwable cause) { super(message, cause); }
}
