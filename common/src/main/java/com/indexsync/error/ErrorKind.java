package com.indexsync.error;

/**
 * Closed set of failure categories. The kind alone decides whether a failed
 * operation is worth another attempt.
 */
public enum ErrorKind {

    DECODE(false),
    VALIDATION(false),
    STORE_UNAVAILABLE(true),
    CONFLICT(false),
    RETRY_EXHAUSTED(false),
    PROVISIONING(false),
    CANCELLED(false),
    CONSUMER(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
