package com.indexsync.sync;

import com.indexsync.bulk.BulkBuffer;
import com.indexsync.bulk.BulkOperation;
import com.indexsync.bulk.FlushListener;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.ErrorKind;
import com.indexsync.error.RetryExhaustedException;
import com.indexsync.error.SyncException;
import com.indexsync.kafka.FailureQueuePublisher;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.ChangeOperation;
import com.indexsync.model.SourcePosition;
import com.indexsync.model.SyncEntity;
import com.indexsync.serde.ChangeEventDecoder;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.List;

/**
 * Turns one consumed Kafka record into an index write.
 *
 * <p>Terminal failures are logged, counted and sent to the failure queue, after
 * which the record counts as handled.  Only cancellation, a failure-queue
 * publish error and a full bulk backlog propagate to the caller; all of them
 * leave the offset uncommitted.  In bulk mode the same applies to writes the
 * buffer later gives up on: they are dead-lettered before their offset is
 * released.</p>
 *
 * @param <T> the synchronised entity type
 */
@Slf4j
public class ChangeEventHandler<T extends SyncEntity> {

    private final ChangeEventDecoder<T> decoder;
    private final OperationDispatcher<T> dispatcher;
    private final FailureQueuePublisher failureQueue;
    private final MetricsCollector metrics;
    private final BulkBuffer bulkBuffer;

    /**
     * @param bulkBuffer the buffer to route writes through, or {@code null} to write one at a time
     */
    public ChangeEventHandler(ChangeEventDecoder<T> decoder, OperationDispatcher<T> dispatcher,
                              FailureQueuePublisher failureQueue, MetricsCollector metrics,
                              BulkBuffer bulkBuffer) {
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.failureQueue = failureQueue;
        this.metrics = metrics;
        this.bulkBuffer = bulkBuffer;
        if (bulkBuffer != null) {
            bulkBuffer.addFlushListener(new FlushListener() {
                @Override
                public void onFlushed(List<BulkOperation> applied) {
                    // offsets of applied operations are released by the consumer runner
                }

                @Override
                public void onRejected(BulkOperation rejected, SyncException error) throws SyncException {
                    deadLetter(rejected, error);
                }
            });
        }
    }

    public boolean isBulk() {
        return bulkBuffer != null;
    }

    public MessageOutcome handle(SyncContext ctx, ConsumerRecord<String, byte[]> record) throws SyncException {
        ctx.throwIfCancelled("handle " + record.topic() + "-" + record.partition() + "@" + record.offset());
        SourcePosition source = new SourcePosition(record.topic(), record.partition(), record.offset());

        byte[] value = record.value();
        if (value == null || value.length == 0) {
            log.debug("Skipping tombstone source={}", source);
            return MessageOutcome.SKIPPED;
        }

        ChangeOperation<T> op;
        try {
            op = decoder.decode(value, source);
        } catch (SyncException e) {
            metrics.recordDecodeFailure(e.getErrorCode());
            return terminal(record, source, "decode", e);
        }

        String operation = op.getOperation().tag();
        if (bulkBuffer != null) {
            return buffer(ctx, record, op, source);
        }
        try {
            dispatcher.dispatch(ctx, op);
            return MessageOutcome.APPLIED;
        } catch (SyncException e) {
            if (e.getErrorCode() == ErrorCode.OPERATION_CANCELLED) {
                throw e;
            }
            return terminal(record, source, operation, e);
        }
    }

    /**
     * Hands the write to the bulk buffer.  Flush failures are the buffer's to
     * resolve; anything {@link BulkBuffer#add} throws (a full backlog, a failed
     * dead-letter publish, cancellation) halts the partition.
     */
    private MessageOutcome buffer(SyncContext ctx, ConsumerRecord<String, byte[]> record,
                                  ChangeOperation<T> op, SourcePosition source) throws SyncException {
        BulkOperation bulkOp;
        try {
            bulkOp = dispatcher.toBulkOperation(op);
        } catch (SyncException e) {
            return terminal(record, source, op.getOperation().tag(), e);
        }
        bulkOp.setSourceKey(record.key());
        bulkOp.setSourceValue(record.value());
        bulkBuffer.add(ctx, bulkOp);
        return MessageOutcome.BUFFERED;
    }

    private void deadLetter(BulkOperation op, SyncException error) throws SyncException {
        String operation = op.getOperation().tag();
        metrics.recordSyncFailure(operation, error.getKind());
        log.error("Dropping buffered change event source={} key={} operation={}: {}",
                op.getSource(), op.getSourceKey(), operation, error.toString());
        failureQueue.publish(op.getSource(), op.getSourceKey(), op.getSourceValue(), error);
    }

    private MessageOutcome terminal(ConsumerRecord<String, byte[]> record, SourcePosition source,
                                    String operation, SyncException error) throws SyncException {
        if (!(error instanceof RetryExhaustedException)) {
            metrics.recordSyncFailure(operation, error.getKind());
        }
        log.error("Dropping change event source={} key={} operation={}: {}",
                source, record.key(), operation, error.toString());
        failureQueue.publish(record, error);
        return error.getKind() == ErrorKind.RETRY_EXHAUSTED ? MessageOutcome.FAILED : MessageOutcome.SKIPPED;
    }
}
