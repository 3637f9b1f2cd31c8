package com.indexsync.kafka;

import com.indexsync.bulk.BulkBuffer;
import com.indexsync.bulk.BulkOperation;
import com.indexsync.bulk.FlushListener;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.model.SourcePosition;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.WakeupException;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Consumes the change topics as a member of a consumer group.
 *
 * <p>The calling thread of {@link #start()} owns the consumer: it polls, hands
 * each partition's records to that partition's {@link PartitionWorker} and
 * commits the highest contiguous handled offset of every partition.  A partition
 * is paused while its worker has records in flight, so records of one partition
 * are handled strictly in order while partitions proceed in parallel.</p>
 *
 * <p>On revocation the runner waits up to the grace period for the partition's
 * workers, cancels whatever is still running, commits what completed and drops
 * the partition.  A fatal worker failure moves the runner to
 * {@link RunnerStatus#ERROR} and stops it without committing further.</p>
 */
@Slf4j
public class ConsumerGroupRunner implements Closeable {

    private final Supplier<Consumer<String, byte[]>> consumerSupplier;
    private final RecordProcessor processor;
    private final List<String> topics;
    private final Duration pollTimeout;
    private final Duration revokeGrace;
    private final Duration shutdownTimeout;
    private final BulkBuffer bulkBuffer;

    private final SyncContext rootCtx = SyncContext.background();
    private final Map<TopicPartition, PartitionWorker> workers = new ConcurrentHashMap<>();
    private final Set<TopicPartition> paused = new HashSet<>();
    private final Map<TopicPartition, Long> lastCommitted = new HashMap<>();
    private final BlockingQueue<SyncException> fatalErrors = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final FlushListener flushListener = new BulkReleaseListener();
    private final ConsumerRebalanceListener rebalanceListener = new RebalanceListener();

    private volatile RunnerStatus status = RunnerStatus.INITIALIZED;
    private volatile SyncException fatalError;
    private volatile Consumer<String, byte[]> consumer;
    private Thread errorDrainer;

    /**
     * @param bulkBuffer the buffer whose flushes release buffered offsets, or {@code null}
     */
    public ConsumerGroupRunner(Supplier<Consumer<String, byte[]>> consumerSupplier, RecordProcessor processor,
                               List<String> topics, Duration pollTimeout, Duration revokeGrace,
                               Duration shutdownTimeout, BulkBuffer bulkBuffer) {
        this.consumerSupplier = consumerSupplier;
        this.processor = processor;
        this.topics = List.copyOf(topics);
        this.pollTimeout = pollTimeout;
        this.revokeGrace = revokeGrace;
        this.shutdownTimeout = shutdownTimeout;
        this.bulkBuffer = bulkBuffer;
    }

    public RunnerStatus getStatus() {
        return status;
    }

    public boolean isHealthy() {
        return status == RunnerStatus.RUNNING || status == RunnerStatus.STARTING;
    }

    /**
     * @throws SyncException {@code KAFKA_CONSUMER} when the runner has failed or was closed
     */
    public void healthCheck() throws SyncException {
        RunnerStatus current = status;
        if (current == RunnerStatus.ERROR) {
            SyncException cause = fatalError;
            throw new SyncException(ErrorCode.KAFKA_CONSUMER, "consumer runner failed"
                    + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
        if (current == RunnerStatus.CLOSED) {
            throw new SyncException(ErrorCode.KAFKA_CONSUMER, "consumer runner is " + current.name().toLowerCase());
        }
    }

    /**
     * Runs the poll loop on the calling thread until {@link #stop()} or a fatal failure.
     * Returns at once when the runner was closed before it got here.
     *
     * @throws SyncException {@code KAFKA_CONSUMER} when the loop ended on a fatal failure
     * @throws IllegalStateException when the runner was already started
     */
    public void start() throws SyncException {
        synchronized (this) {
            if (status == RunnerStatus.CLOSED) {
                log.debug("Consumer runner closed before it started topics={}", topics);
                return;
            }
            if (status != RunnerStatus.INITIALIZED) {
                throw new IllegalStateException("runner cannot start from status " + status);
            }
            status = RunnerStatus.STARTING;
            running.set(true);
            consumer = consumerSupplier.get();
        }
        if (bulkBuffer != null) {
            bulkBuffer.addFlushListener(flushListener);
        }
        startErrorDrainer();
        log.info("Starting consumer runner topics={}", topics);

        try {
            consumer.subscribe(topics, rebalanceListener);
            if (status == RunnerStatus.STARTING) {
                status = RunnerStatus.RUNNING;
            }
            while (running.get()) {
                ConsumerRecords<String, byte[]> records;
                try {
                    records = consumer.poll(pollTimeout);
                } catch (WakeupException e) {
                    continue;
                }
                dispatch(records);
                resumeIdlePartitions();
                commitCompleted();
            }
        } catch (KafkaException e) {
            markFailed(new SyncException(ErrorCode.KAFKA_CONSUMER, "consumer failed: " + e.getMessage(), e));
        } finally {
            shutdown();
        }

        if (status == RunnerStatus.ERROR) {
            SyncException cause = fatalError;
            throw new SyncException(ErrorCode.KAFKA_CONSUMER, "consumer runner stopped on failure"
                    + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
    }

    /** Asks the poll loop to exit; safe from any thread. */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping consumer runner topics={}", topics);
        }
        Consumer<String, byte[]> current = consumer;
        if (current != null) {
            current.wakeup();
        }
    }

    @Override
    public void close() {
        boolean started;
        synchronized (this) {
            started = status != RunnerStatus.INITIALIZED;
            if (!started) {
                status = RunnerStatus.CLOSED;
            }
        }
        if (started) {
            stop();
            try {
                if (!terminated.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Consumer runner did not stop within {} ms", shutdownTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (status != RunnerStatus.ERROR) {
                status = RunnerStatus.CLOSED;
            }
        }
        rootCtx.cancel();
    }

    ConsumerRebalanceListener rebalanceListener() {
        return rebalanceListener;
    }

    // ── Poll loop ────────────────────────────────────────────────────────

    private void dispatch(ConsumerRecords<String, byte[]> records) {
        for (TopicPartition tp : records.partitions()) {
            List<ConsumerRecord<String, byte[]>> partitionRecords = records.records(tp);
            if (partitionRecords.isEmpty()) {
                continue;
            }
            PartitionWorker worker = workers.computeIfAbsent(tp,
                    p -> new PartitionWorker(p, processor, rootCtx, fatalErrors::offer));
            worker.enqueue(partitionRecords);
            if (paused.add(tp)) {
                consumer.pause(Collections.singleton(tp));
            }
        }
    }

    private void resumeIdlePartitions() {
        Set<TopicPartition> assignment = consumer.assignment();
        List<TopicPartition> resumable = new ArrayList<>();
        for (TopicPartition tp : new ArrayList<>(paused)) {
            PartitionWorker worker = workers.get(tp);
            if (worker == null || !assignment.contains(tp)) {
                paused.remove(tp);
            } else if (worker.isIdle()) {
                paused.remove(tp);
                resumable.add(tp);
            }
        }
        if (!resumable.isEmpty()) {
            consumer.resume(resumable);
        }
    }

    private void commitCompleted() {
        Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
        workers.forEach((tp, worker) -> nextCommit(tp, worker).ifPresent(o -> commits.put(tp, o)));
        commit(commits);
    }

    private Optional<OffsetAndMetadata> nextCommit(TopicPartition tp, PartitionWorker worker) {
        OptionalLong next = worker.tracker().committable();
        if (next.isEmpty() || next.getAsLong() <= lastCommitted.getOrDefault(tp, -1L)) {
            return Optional.empty();
        }
        return Optional.of(new OffsetAndMetadata(next.getAsLong()));
    }

    private void commit(Map<TopicPartition, OffsetAndMetadata> commits) {
        if (commits.isEmpty() || status == RunnerStatus.ERROR) {
            return;
        }
        try {
            consumer.commitSync(commits);
            commits.forEach((tp, o) -> lastCommitted.put(tp, o.offset()));
            log.debug("Committed offsets {}", commits);
        } catch (CommitFailedException | RebalanceInProgressException e) {
            log.warn("Offset commit rejected, will retry after rebalance: {}", e.getMessage());
        } catch (WakeupException e) {
            log.debug("Offset commit interrupted by wakeup, retrying on the next pass");
        }
    }

    private void flushBuffer(String reason) {
        if (bulkBuffer == null) {
            return;
        }
        try (SyncContext flushCtx = rootCtx.withTimeout(shutdownTimeout)) {
            bulkBuffer.flush(flushCtx);
        } catch (SyncException e) {
            log.warn("Bulk flush on {} failed, buffered offsets stay uncommitted: {}", reason, e.getMessage());
        }
    }

    private void release(BulkOperation op) {
        SourcePosition source = op.getSource();
        if (source == null) {
            return;
        }
        PartitionWorker worker = workers.get(new TopicPartition(source.getTopic(), source.getPartition()));
        if (worker != null) {
            worker.tracker().complete(source.getOffset());
        }
    }

    /** Releases the offsets of buffered records once the bulk buffer is done with them. */
    private class BulkReleaseListener implements FlushListener {

        @Override
        public void onFlushed(List<BulkOperation> applied) {
            for (BulkOperation op : applied) {
                release(op);
            }
        }

        @Override
        public void onRejected(BulkOperation rejected, SyncException error) {
            release(rejected);
        }
    }

    // ── Failure handling ─────────────────────────────────────────────────

    private void startErrorDrainer() {
        errorDrainer = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    markFailed(fatalErrors.take());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "indexsync-runner-errors");
        errorDrainer.setDaemon(true);
        errorDrainer.start();
    }

    private void markFailed(SyncException error) {
        if (fatalError == null) {
            fatalError = error;
        }
        status = RunnerStatus.ERROR;
        log.error("Consumer runner failed: {}", error.toString());
        stop();
    }

    private void shutdown() {
        List<PartitionWorker> remaining = new ArrayList<>(workers.values());
        for (PartitionWorker worker : remaining) {
            worker.drain(shutdownTimeout, shutdownTimeout);
        }
        if (status != RunnerStatus.ERROR) {
            flushBuffer("shutdown");
            try {
                commitCompleted();
            } catch (KafkaException e) {
                log.warn("Final offset commit failed: {}", e.getMessage());
            }
        }
        remaining.forEach(PartitionWorker::close);
        workers.clear();
        paused.clear();
        if (bulkBuffer != null) {
            bulkBuffer.removeFlushListener(flushListener);
        }
        try {
            consumer.close(shutdownTimeout);
        } catch (KafkaException e) {
            log.warn("Consumer close failed: {}", e.getMessage());
        }
        if (errorDrainer != null) {
            errorDrainer.interrupt();
        }
        SyncException late = fatalErrors.poll();
        if (late != null) {
            markFailed(late);
        }
        if (status != RunnerStatus.ERROR && status != RunnerStatus.CLOSED) {
            status = RunnerStatus.STOPPED;
        }
        terminated.countDown();
        log.info("Consumer runner stopped status={}", status);
    }

    // ── Rebalance ────────────────────────────────────────────────────────

    private class RebalanceListener implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            List<PartitionWorker> revoked = new ArrayList<>();
            for (TopicPartition tp : partitions) {
                PartitionWorker worker = workers.get(tp);
                if (worker != null) {
                    revoked.add(worker);
                }
            }
            if (revoked.isEmpty()) {
                return;
            }
            log.info("Partitions revoked {}", partitions);
            for (PartitionWorker worker : revoked) {
                worker.drain(revokeGrace, shutdownTimeout);
            }
            flushBuffer("revoke");

            Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
            for (PartitionWorker worker : revoked) {
                nextCommit(worker.partition(), worker).ifPresent(o -> commits.put(worker.partition(), o));
            }
            commit(commits);
            for (PartitionWorker worker : revoked) {
                drop(worker.partition());
            }
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Partitions assigned {}", partitions);
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            log.warn("Partitions lost {}, dropping without commit", partitions);
            for (TopicPartition tp : partitions) {
                drop(tp);
            }
        }

        private void drop(TopicPartition tp) {
            PartitionWorker worker = workers.remove(tp);
            if (worker != null) {
                worker.close();
            }
            paused.remove(tp);
            lastCommitted.remove(tp);
        }
    }
}
