package com.indexsync.bulk;

import com.indexsync.elasticsearch.BulkItemFailure;
import com.indexsync.elasticsearch.IndexWriter;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.retry.BackoffPolicy;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Accumulates write operations and submits them as one bulk request.
 *
 * <p>Thread-safe: every method is {@code synchronized}, so a flush encodes and
 * submits a consistent snapshot and no {@link #add} interleaves with it.</p>
 *
 * <p>What happens to an operation after a submission depends on how it failed:</p>
 * <ul>
 *   <li>applied operations leave the buffer and are reported through
 *       {@link FlushListener#onFlushed};</li>
 *   <li>operations the cluster rejects with a non-retryable error (a 400 or 409
 *       item, or a fatal failure of the whole request) leave the buffer and are
 *       reported through {@link FlushListener#onRejected};</li>
 *   <li>operations that failed retryably stay buffered.  Size-triggered flushes
 *       then wait out the backoff delay, and an operation that failed on more
 *       submissions than the policy's retry count is rejected with
 *       {@code RETRY_EXHAUSTED}.</li>
 * </ul>
 *
 * <p>The buffer holds at most {@value #BACKLOG_BATCHES} batches; past that
 * {@link #add} refuses with {@code BULK_BACKLOG} so the caller stops feeding it.</p>
 */
@Slf4j
public class BulkBuffer {

    static final int BACKLOG_BATCHES = 4;

    private final IndexWriter writer;
    private final BulkRequestEncoder encoder;
    private final MetricsCollector metrics;
    private final String entityType;
    private final int batchSize;
    private final Duration flushTimeout;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final List<FlushListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Entry> pending = new ArrayList<>();

    private int consecutiveFailures;
    private Instant retryNotBefore;

    public BulkBuffer(IndexWriter writer, BulkRequestEncoder encoder, MetricsCollector metrics,
                      String entityType, int batchSize, Duration flushTimeout,
                      BackoffPolicy backoff, Clock clock) {
        this.writer = writer;
        this.encoder = encoder;
        this.metrics = metrics;
        this.entityType = entityType;
        this.batchSize = batchSize;
        this.flushTimeout = flushTimeout;
        this.backoff = backoff;
        this.clock = clock;
    }

    public void addFlushListener(FlushListener listener) {
        listeners.add(listener);
    }

    public void removeFlushListener(FlushListener listener) {
        listeners.remove(listener);
    }

    /**
     * Appends {@code op}; the call that brings the buffer to {@code batchSize}
     * flushes it unless a previous failure's backoff is still running.  A failed
     * flush is not reported here: the operations stay buffered.
     *
     * @throws SyncException {@code VALIDATION_FAILED} when the op has no id,
     *                       {@code BULK_BACKLOG} when the buffer is full (in both cases
     *                       nothing is appended), or whatever a rejection listener threw
     */
    public synchronized void add(SyncContext ctx, BulkOperation op) throws SyncException {
        if (op.getId() == null || op.getId().isBlank()) {
            throw new SyncException(ErrorCode.VALIDATION_FAILED, "bulk operation has no id");
        }
        if (pending.size() >= capacity()) {
            if (isFlushDue()) {
                flushQuietly(ctx);
            }
            if (pending.size() >= capacity()) {
                throw new SyncException(ErrorCode.BULK_BACKLOG, "bulk buffer entity=" + entityType
                        + " holds " + pending.size() + " operations awaiting a successful flush");
            }
        }
        pending.add(new Entry(op));
        if (pending.size() >= batchSize && isFlushDue()) {
            flushQuietly(ctx);
        }
    }

    /**
     * Submits everything buffered, regardless of backoff.
     *
     * @return the number of operations applied
     * @throws SyncException {@code BULK_FAILED} when operations remain buffered after a
     *                       retryable failure, {@code OPERATION_CANCELLED}, or whatever a
     *                       rejection listener threw
     */
    public synchronized int flush(SyncContext ctx) throws SyncException {
        return flushLocked(ctx);
    }

    public synchronized int size() {
        return pending.size();
    }

    // ── Internals ────────────────────────────────────────────────────────

    private int capacity() {
        return batchSize * BACKLOG_BATCHES;
    }

    private boolean isFlushDue() {
        return retryNotBefore == null || !clock.instant().isBefore(retryNotBefore);
    }

    private void flushQuietly(SyncContext ctx) throws SyncException {
        try {
            flushLocked(ctx);
        } catch (SyncException e) {
            if (e.getErrorCode() != ErrorCode.BULK_FAILED) {
                throw e;
            }
            log.warn("Bulk flush failed entity={}, {} operations stay buffered: {}",
                    entityType, pending.size(), e.getMessage());
        }
    }

    private int flushLocked(SyncContext ctx) throws SyncException {
        if (pending.isEmpty()) {
            return 0;
        }
        List<Entry> batch = List.copyOf(pending);
        List<BulkOperation> operations = new ArrayList<>(batch.size());
        for (Entry entry : batch) {
            operations.add(entry.op);
        }
        String body = encoder.encode(operations);

        List<BulkItemFailure> itemFailures;
        try (SyncContext flushCtx = ctx.withTimeout(flushTimeout)) {
            itemFailures = writer.bulk(flushCtx, body, batch.size());
        } catch (SyncException e) {
            metrics.recordBulk(entityType, "error", batch.size());
            if (e.getErrorCode() == ErrorCode.OPERATION_CANCELLED) {
                throw e;
            }
            if (!e.isRetryable()) {
                log.error("Bulk of {} operations rejected entity={}: {}", batch.size(), entityType, e.toString());
                reject(batch, e);
                return 0;
            }
            if (retryLater(batch, e) > 0) {
                throw new SyncException(ErrorCode.BULK_FAILED,
                        "bulk flush of " + batch.size() + " operations failed: " + e.getMessage(), e);
            }
            return 0;
        }

        Map<Integer, BulkItemFailure> failedAt = new HashMap<>();
        for (BulkItemFailure failure : itemFailures) {
            failedAt.put(failure.getPosition(), failure);
        }
        List<Entry> applied = new ArrayList<>();
        List<Entry> retryable = new ArrayList<>();
        Map<Entry, SyncException> rejected = new LinkedHashMap<>();
        SyncException retryCause = null;
        for (int i = 0; i < batch.size(); i++) {
            BulkItemFailure failure = failedAt.get(i);
            if (failure == null) {
                applied.add(batch.get(i));
                continue;
            }
            SyncException error = failure.toException();
            if (error.isRetryable()) {
                retryable.add(batch.get(i));
                retryCause = retryCause == null ? error : retryCause;
            } else {
                rejected.put(batch.get(i), error);
            }
        }

        pending.removeAll(applied);
        if (!applied.isEmpty()) {
            metrics.recordBulk(entityType, "success", applied.size());
            log.debug("Flushed bulk of {} operations entity={}", applied.size(), entityType);
            List<BulkOperation> appliedOps = new ArrayList<>(applied.size());
            for (Entry entry : applied) {
                appliedOps.add(entry.op);
            }
            for (FlushListener listener : listeners) {
                listener.onFlushed(appliedOps);
            }
        }
        for (Map.Entry<Entry, SyncException> item : rejected.entrySet()) {
            log.error("Bulk item rejected entity={} id={} source={}: {}", entityType,
                    item.getKey().op.getId(), item.getKey().op.getSource(), item.getValue().getMessage());
            reject(List.of(item.getKey()), item.getValue());
        }

        if (!retryable.isEmpty()) {
            int remaining = retryLater(retryable, retryCause);
            if (remaining > 0) {
                throw new SyncException(ErrorCode.BULK_FAILED, remaining + " of " + batch.size()
                        + " bulk operations failed: " + retryCause.getMessage(), retryCause);
            }
            return applied.size();
        }
        consecutiveFailures = 0;
        retryNotBefore = null;
        return applied.size();
    }

    /**
     * Schedules the next attempt for {@code entries} and rejects those out of attempts.
     *
     * @return how many of {@code entries} stay buffered
     */
    private int retryLater(List<Entry> entries, SyncException cause) throws SyncException {
        Duration delay = backoff.delay(consecutiveFailures);
        consecutiveFailures++;
        retryNotBefore = clock.instant().plus(delay);

        List<Entry> exhausted = new ArrayList<>();
        for (Entry entry : entries) {
            entry.attempts++;
            if (entry.attempts > backoff.getMaxAttempts()) {
                exhausted.add(entry);
            }
        }
        if (!exhausted.isEmpty()) {
            log.error("Giving up on {} bulk operations entity={} after {} failed submissions: {}",
                    exhausted.size(), entityType, exhausted.get(0).attempts, cause.getMessage());
            reject(exhausted, new SyncException(ErrorCode.RETRY_EXHAUSTED,
                    "bulk write failed on " + exhausted.get(0).attempts + " submissions: " + cause.getMessage(),
                    cause));
        }
        return entries.size() - exhausted.size();
    }

    /**
     * Drops {@code entries} from the buffer and reports each one.  When a listener
     * throws, the entries not yet fully reported go back to the front of the buffer.
     */
    private void reject(List<Entry> entries, SyncException error) throws SyncException {
        pending.removeAll(entries);
        metrics.recordBulk(entityType, "rejected", entries.size());
        for (int i = 0; i < entries.size(); i++) {
            try {
                for (FlushListener listener : listeners) {
                    listener.onRejected(entries.get(i).op, error);
                }
            } catch (SyncException e) {
                pending.addAll(0, entries.subList(i, entries.size()));
                throw e;
            }
        }
    }

    /** Buffered operation with the number of submissions it has failed. */
    private static final class Entry {

        private final BulkOperation op;
        private int attempts;

        private Entry(BulkOperation op) {
            this.op = op;
        }
    }
}
