package com.indexsync.metrics;

import com.indexsync.model.OperationType;

import java.time.Duration;

/**
 * Timing handle for one attempt of a single-document operation.
 * Exactly one of {@link #success(long)} or {@link #failure(long)} is called.
 */
public class OperationMetrics {

    private final MetricsCollector collector;
    private final OperationType operation;
    private final String entity;
    private final long startNanos;

    OperationMetrics(MetricsCollector collector, OperationType operation, String entity, long startNanos) {
        this.collector = collector;
        this.operation = operation;
        this.entity = entity;
        this.startNanos = startNanos;
    }

    public void success(long payloadBytes) {
        finish("success", payloadBytes);
    }

    public void failure(long payloadBytes) {
        finish("error", payloadBytes);
        collector.recordError(operation, entity);
    }

    private void finish(String status, long payloadBytes) {
        collector.recordOperation(operation, entity, status, Duration.ofNanos(System.nanoTime() - startNanos));
        collector.recordPayloadSize(operation, entity, payloadBytes);
    }
}
