package com.indexsync.error;

import com.indexsync.retry.RetryHistory;

/**
 * Thrown when every permitted retry attempt failed with a retryable error.
 * The last attempt's failure is the cause.
 */
public class RetryExhaustedException extends SyncException {

    private static final long serialVersionUID = 1L;

    private final transient RetryHistory history;

    public RetryExhaustedException(SyncException lastError, RetryHistory history) {
        super(ErrorCode.RETRY_EXHAUSTED,
                "retries exhausted after " + history.attemptCount() + " attempts: " + lastError.getMessage(),
                history.getOperation(), history.getEntityId(), lastError);
        this.history = history;
    }

    public SyncException getLastError() {
        return (SyncException) getCause();
    }

    public RetryHistory getHistory() {
        return history;
    }
}
