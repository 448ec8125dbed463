package com.callperf.agent.sink;

/** Non-retryable failure: schema mismatch, access denied, invalid destination. */
public class PermanentDeliveryException extends DeliveryException {

    public PermanentDeliveryException(String message) { super(message); }
    public PermanentDeliveryException(String message, Throwable cause) { super(message, cause); }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
