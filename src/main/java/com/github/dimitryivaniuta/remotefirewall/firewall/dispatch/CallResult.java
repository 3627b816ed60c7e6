package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

import java.util.Optional;

/**
 * What a request/response caller gets back. Failures are a sentinel value, never an exception.
 */
public final class CallResult {

    private final boolean success;
    private final Object value;
    private final CallStage failedStage;
    private final String reason;
    private final long logIndex;

    private CallResult(boolean success, Object value, CallStage failedStage, String reason, long logIndex) {
        this.success = success;
        this.value = value;
        this.failedStage = failedStage;
        this.reason = reason;
        this.logIndex = logIndex;
    }

    public static CallResult success(Object value, long logIndex) {
        return new CallResult(true, value, null, null, logIndex);
    }

    public static CallResult failure(CallStage stage, String reason, long logIndex) {
        return new CallResult(false, null, stage, reason, logIndex);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Callback's return value; empty when the call failed or the callback returned nothing.
     */
    public Optional<Object> value() {
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        return value != null;
    }

    public Optional<CallStage> failedStage() {
        return Optional.ofNullable(failedStage);
    }

    public String reason() {
        return reason;
    }

    public long logIndex() {
        return logIndex;
    }

    @Override
    public String toString() {
        return success
                ? "CallResult[success, value=" + value + ", logIndex=" + logIndex + "]"
                : "CallResult[failed at " + failedStage + ": " + reason + ", logIndex=" + logIndex + "]";
    }
}
