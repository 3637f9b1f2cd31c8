package com.indexsync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexsync.bulk.BulkOperation;
import com.indexsync.elasticsearch.IndexNamer;
import com.indexsync.elasticsearch.IndexWriter;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.ErrorKind;
import com.indexsync.error.RetryExhaustedException;
import com.indexsync.error.SyncException;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.metrics.OperationMetrics;
import com.indexsync.model.ChangeOperation;
import com.indexsync.model.OperationType;
import com.indexsync.model.SyncEntity;
import com.indexsync.model.SyncRecord;
import com.indexsync.retry.RetryEngine;
import com.indexsync.serde.JsonMappers;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Applies one decoded change to the index.
 *
 * <p>Validates the payload, resolves the current monthly index, then issues the
 * write matching the operation: a full index for {@code CREATE}, a partial
 * {@code doc_as_upsert} update for {@code UPDATE} and a delete for {@code DELETE}.
 * Each attempt is bounded by the operation timeout.  A retryable failure hands the
 * same operation to the {@link RetryEngine}.</p>
 *
 * @param <T> the synchronised entity type
 */
@Slf4j
public class OperationDispatcher<T extends SyncEntity> {

    private final IndexWriter writer;
    private final IndexNamer namer;
    private final RetryEngine retryEngine;
    private final MetricsCollector metrics;
    private final String entityType;
    private final Duration operationTimeout;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMappers.create();

    public OperationDispatcher(IndexWriter writer, IndexNamer namer, RetryEngine retryEngine,
                               MetricsCollector metrics, String entityType,
                               Duration operationTimeout, Clock clock) {
        this.writer = writer;
        this.namer = namer;
        this.retryEngine = retryEngine;
        this.metrics = metrics;
        this.entityType = entityType;
        this.operationTimeout = operationTimeout;
        this.clock = clock;
    }

    /**
     * Applies {@code op}, retrying transient failures.
     *
     * @return the finalised record with status {@code SUCCESS}
     * @throws RetryExhaustedException when transient failures outlast the retry budget
     * @throws SyncException           validation, conflict, rejection or cancellation
     */
    public SyncRecord dispatch(SyncContext ctx, ChangeOperation<T> op) throws SyncException {
        OperationType type = op.getOperation();
        String id = op.getEntityId();
        T payload = op.getPayload();
        long payloadSize = payloadSize(payload);
        SyncRecord record = SyncRecord.pending(entityType, id, type);

        validate(op, payloadSize);

        try {
            attempt(ctx, type, id, payload, payloadSize);
        } catch (SyncException first) {
            if (!first.isRetryable()) {
                record.markFailed(first.getMessage(), null);
                throw first.withContext(type.tag(), id);
            }
            log.warn("Write failed, retrying operation={} id={}: {}", type.tag(), id, first.toString());
            try {
                retryEngine.run(type.tag(), id, ctx, first, n -> {
                    record.markRetrying();
                    attempt(ctx, type, id, payload, payloadSize);
                    return null;
                });
            } catch (RetryExhaustedException exhausted) {
                record.markFailed(exhausted.getLastError().getMessage(), retryEngine.getPolicy().getBaseDelay());
                metrics.recordSyncFailure(type.tag(), ErrorKind.RETRY_EXHAUSTED);
                log.error("Sync failed permanently record={}", record);
                throw exhausted;
            } catch (SyncException fatal) {
                record.markFailed(fatal.getMessage(), null);
                throw fatal.withContext(type.tag(), id);
            }
        }

        record.markSuccess();
        log.debug("Synced record={}", record);
        return record;
    }

    /**
     * Validates {@code op} and turns it into a bulk operation against the current index.
     */
    public BulkOperation toBulkOperation(ChangeOperation<T> op) throws SyncException {
        T payload = op.getPayload();
        validate(op, payloadSize(payload));
        if (op.getOperation() != OperationType.DELETE) {
            payload.markSynced(clock.instant());
        }
        return BulkOperation.builder()
                .operation(op.getOperation())
                .index(namer.currentIndex())
                .id(op.getEntityId())
                .document(op.getOperation() == OperationType.DELETE ? null : payload)
                .source(op.getSource())
                .build();
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void validate(ChangeOperation<T> op, long payloadSize) throws SyncException {
        String id = op.getEntityId();
        String operation = op.getOperation().tag();
        try {
            if (id == null || id.isBlank()) {
                throw new SyncException(ErrorCode.VALIDATION_FAILED, "payload id is empty");
            }
            if (op.getOperation() != OperationType.DELETE) {
                op.getPayload().validate();
            }
        } catch (SyncException e) {
            log.error("Validation failed operation={} id={} payloadSize={}: {}",
                    operation, id, payloadSize, e.getMessage());
            throw e.withContext(operation, id);
        }
    }

    private void attempt(SyncContext ctx, OperationType type, String id, T payload, long payloadSize)
            throws SyncException {
        String index = namer.currentIndex();
        OperationMetrics attemptMetrics = metrics.start(type, entityType);
        try (SyncContext attemptCtx = ctx.withTimeout(operationTimeout)) {
            switch (type) {
                case CREATE -> {
                    payload.markSynced(clock.instant());
                    writer.index(attemptCtx, index, id, payload);
                }
                case UPDATE -> {
                    payload.markSynced(clock.instant());
                    writer.upsert(attemptCtx, index, id, payload);
                }
                case DELETE -> writer.delete(attemptCtx, index, id);
                default -> throw new SyncException(ErrorCode.UNKNOWN_OPERATION, "unsupported operation " + type);
            }
            attemptMetrics.success(payloadSize);
        } catch (SyncException e) {
            attemptMetrics.failure(payloadSize);
            throw e;
        }
    }

    private long payloadSize(T payload) {
        try {
            return objectMapper.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            log.debug("Could not measure payload size: {}", e.getMessage());
            return 0;
        }
    }
}
