package com.indexsync.retry;

import com.indexsync.config.SyncConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with ±20% jitter, capped at a maximum delay.
 *
 * <p>{@code delay(n) = min(base × factor^n × jitter, max)} with jitter drawn
 * uniformly from {@code [0.8, 1.2]}.</p>
 */
public class BackoffPolicy {

    static final double JITTER_LOW = 0.8;
    static final double JITTER_HIGH = 1.2;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double factor;
    private final DoubleSupplier jitter;

    public BackoffPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double factor) {
        this(maxAttempts, baseDelay, maxDelay, factor,
                () -> ThreadLocalRandom.current().nextDouble(JITTER_LOW, JITTER_HIGH));
    }

    /**
     * @param jitter source of the multiplicative jitter; tests pin it to a constant
     */
    public BackoffPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double factor,
                         DoubleSupplier jitter) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.factor = factor;
        this.jitter = jitter;
    }

    public static BackoffPolicy fromConfig(SyncConfig.CustomSection custom) {
        return new BackoffPolicy(custom.getMaxRetries(),
                Duration.ofMillis(custom.getRetryDelayMs()),
                Duration.ofMillis(custom.getMaxRetryDelayMs()),
                custom.getBackoffFactor());
    }

    /**
     * Delay to wait before the zero-based retry attempt {@code attempt}.
     */
    public Duration delay(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(factor, attempt) * jitter.getAsDouble();
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getFactor() {
        return factor;
    }
}
