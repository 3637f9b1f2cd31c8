package com.indexsync.metrics;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.ErrorKind;
import com.indexsync.model.OperationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records synchronisation metrics into a Micrometer {@link MeterRegistry}.
 *
 * <p>One instance is created by the engine wiring and passed to every component
 * that records metrics.  {@link #init()} registers the meters known up front;
 * {@link #cleanup()} removes every meter this collector registered.</p>
 */
@Slf4j
public class MetricsCollector {

    public static final String OPERATION_DURATION = "indexsync.operation.duration";
    public static final String OPERATIONS = "indexsync.operations";
    public static final String OPERATION_ERRORS = "indexsync.operation.errors";
    public static final String PAYLOAD_SIZE = "indexsync.payload.size";
    public static final String BULK_OPERATIONS = "indexsync.bulk.operations";
    public static final String RETRY_ATTEMPTS = "indexsync.retry.attempts";
    public static final String DECODE_FAILURES = "indexsync.decode.failures";
    public static final String SYNC_FAILURES = "indexsync.sync.failures";
    public static final String DEAD_LETTERS = "indexsync.dead.letters";

    private final MeterRegistry registry;
    private final Set<Meter.Id> registered = ConcurrentHashMap.newKeySet();
    private volatile Counter deadLetters;

    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;
    }

    public void init() {
        deadLetters = track(Counter.builder(DEAD_LETTERS)
                .description("Terminal failures published to the failure queue")
                .register(registry));
        log.info("Metrics collector initialised, registry={}", registry.getClass().getSimpleName());
    }

    public void cleanup() {
        for (Meter.Id id : registered) {
            registry.remove(id);
        }
        log.info("Metrics collector cleaned up, removed {} meters", registered.size());
        registered.clear();
        deadLetters = null;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /** Starts timing a single-document operation. */
    public OperationMetrics start(OperationType operation, String entity) {
        return new OperationMetrics(this, operation, entity, System.nanoTime());
    }

    // ── Recorders ────────────────────────────────────────────────────────

    void recordOperation(OperationType operation, String entity, String status, Duration duration) {
        track(Timer.builder(OPERATION_DURATION)
                .description("Duration of single-document index operations")
                .tag("operation", operation.tag())
                .tag("entity", entity)
                .tag("status", status)
                .register(registry)).record(duration);
        track(Counter.builder(OPERATIONS)
                .description("Single-document index operations by outcome")
                .tag("operation", operation.tag())
                .tag("entity", entity)
                .tag("status", status)
                .register(registry)).increment();
    }

    void recordError(OperationType operation, String entity) {
        track(Counter.builder(OPERATION_ERRORS)
                .tag("operation", operation.tag())
                .tag("entity", entity)
                .register(registry)).increment();
    }

    void recordPayloadSize(OperationType operation, String entity, long bytes) {
        track(DistributionSummary.builder(PAYLOAD_SIZE)
                .baseUnit("bytes")
                .tag("operation", operation.tag())
                .tag("entity", entity)
                .register(registry)).record(bytes);
    }

    public void recordBulk(String entity, String status, int batchSize) {
        track(DistributionSummary.builder(BULK_OPERATIONS)
                .description("Operations per bulk submission")
                .tag("entity", entity)
                .tag("status", status)
                .register(registry)).record(batchSize);
    }

    public void recordRetryAttempt(String operation, String entity) {
        track(Counter.builder(RETRY_ATTEMPTS)
                .tag("operation", operation)
                .tag("entity", entity)
                .register(registry)).increment();
    }

    public void recordDecodeFailure(ErrorCode code) {
        track(Counter.builder(DECODE_FAILURES)
                .tag("code", code.name())
                .register(registry)).increment();
    }

    public void recordSyncFailure(String operation, ErrorKind kind) {
        track(Counter.builder(SYNC_FAILURES)
                .description("Change events that terminally failed to synchronise")
                .tag("operation", operation)
                .tag("kind", kind.name())
                .register(registry)).increment();
    }

    public void recordDeadLetter() {
        Counter counter = deadLetters;
        if (counter == null) {
            counter = track(Counter.builder(DEAD_LETTERS).register(registry));
        }
        counter.increment();
    }

    private <M extends Meter> M track(M meter) {
        registered.add(meter.getId());
        return meter;
    }
}
