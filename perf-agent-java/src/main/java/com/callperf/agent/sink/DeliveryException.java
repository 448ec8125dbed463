package com.callperf.agent.sink;

/** Base type for sink write failures. */
public abstract class DeliveryException extends RuntimeException {

    protected DeliveryException(String message) { super(message); }
    protected DeliveryException(String message, Throwable cause) { super(message, cause); }

    /** True when retrying the same write may succeed. */
    public abstract boolean isRetryable();
}
