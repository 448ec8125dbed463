package com.callperf.agent.sink;

/** Retryable failure: timeout, throttling, temporary I/O or network trouble. */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(String message) { super(message); }
    public TransientDeliveryException(String message, Throwable cause) { super(message, cause); }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
