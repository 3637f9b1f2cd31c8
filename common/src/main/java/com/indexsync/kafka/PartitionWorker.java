package com.indexsync.kafka;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.sync.MessageOutcome;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Processes the records of one assigned partition, in offset order, on a
 * dedicated thread.
 *
 * <p>Offsets are registered with the {@link OffsetTracker} by the poll thread
 * before submission and completed here once handled.  Buffered records are
 * completed later by the bulk flush.  After a fatal failure the worker stops
 * handling records so nothing past the failed offset is acknowledged.</p>
 */
@Slf4j
class PartitionWorker {

    private final TopicPartition partition;
    private final RecordProcessor processor;
    private final Consumer<SyncException> fatalSink;
    private final SyncContext ctx;
    private final OffsetTracker tracker = new OffsetTracker();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean failed = new AtomicBoolean();
    private final ExecutorService executor;

    PartitionWorker(TopicPartition partition, RecordProcessor processor, SyncContext parent,
                    Consumer<SyncException> fatalSink) {
        this.partition = partition;
        this.processor = processor;
        this.fatalSink = fatalSink;
        this.ctx = parent.child();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "indexsync-" + partition);
            t.setDaemon(true);
            return t;
        });
    }

    TopicPartition partition() {
        return partition;
    }

    OffsetTracker tracker() {
        return tracker;
    }

    boolean isIdle() {
        return inFlight.get() == 0;
    }

    /** Registers and submits {@code records}; called on the poll thread. */
    void enqueue(List<ConsumerRecord<String, byte[]>> records) {
        for (ConsumerRecord<String, byte[]> record : records) {
            tracker.register(record.offset());
            inFlight.incrementAndGet();
            executor.execute(() -> process(record));
        }
    }

    /**
     * Waits up to {@code grace} for queued records to finish, then cancels the
     * rest and waits up to {@code hardLimit} for the in-flight one to stop.
     *
     * @return true when the worker drained without cancellation
     */
    boolean drain(Duration grace, Duration hardLimit) {
        Future<?> barrier = executor.submit(() -> { });
        if (await(barrier, grace)) {
            return true;
        }
        log.warn("Partition {} did not drain within {} ms, cancelling {} in-flight records",
                partition, grace.toMillis(), inFlight.get());
        ctx.cancel();
        if (!await(barrier, hardLimit)) {
            log.warn("Partition {} worker still busy after cancellation", partition);
        }
        return false;
    }

    void close() {
        ctx.cancel();
        ctx.close();
        executor.shutdownNow();
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void process(ConsumerRecord<String, byte[]> record) {
        try {
            if (ctx.isCancelled() || failed.get()) {
                return;
            }
            MessageOutcome outcome = processor.process(ctx, record);
            if (outcome != MessageOutcome.BUFFERED) {
                tracker.complete(record.offset());
            }
            log.trace("Handled partition={} offset={} outcome={}", partition, record.offset(), outcome);
        } catch (SyncException e) {
            if (e.getErrorCode() == ErrorCode.OPERATION_CANCELLED) {
                log.debug("Cancelled partition={} offset={}", partition, record.offset());
            } else {
                fail(record, e);
            }
        } catch (RuntimeException e) {
            fail(record, new SyncException(ErrorCode.KAFKA_CONSUMER,
                    "unexpected failure at " + partition + "@" + record.offset() + ": " + e.getMessage(), e));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void fail(ConsumerRecord<String, byte[]> record, SyncException e) {
        if (failed.compareAndSet(false, true)) {
            log.error("Partition {} halted at offset={}: {}", partition, record.offset(), e.toString());
            fatalSink.accept(e);
        }
    }

    private boolean await(Future<?> future, Duration timeout) {
        try {
            future.get(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("Partition {} drain barrier failed", partition, e);
            return true;
        }
    }
}
