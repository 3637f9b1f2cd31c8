package com.indexsync.retry;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * One retry attempt of a sequence: when it ran, how long it took and how it ended.
 */
@Data
@AllArgsConstructor
public class RetryAttempt {

    private int attempt;
    private Instant startedAt;
    private Duration waited;
    private Duration duration;
    /** Null when the attempt succeeded. */
    private String error;

    public boolean isSuccess() {
        return error == null;
    }
}
