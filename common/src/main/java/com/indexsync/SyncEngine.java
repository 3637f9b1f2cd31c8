package com.indexsync;

import com.indexsync.bulk.BulkBuffer;
import com.indexsync.bulk.BulkRequestEncoder;
import com.indexsync.config.SyncConfig;
import com.indexsync.config.SyncMode;
import com.indexsync.elasticsearch.ElasticsearchIndexWriter;
import com.indexsync.elasticsearch.IndexNamer;
import com.indexsync.elasticsearch.IndexProvisioner;
import com.indexsync.elasticsearch.IndexWriter;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.kafka.ConsumerGroupRunner;
import com.indexsync.kafka.FailureQueuePublisher;
import com.indexsync.kafka.KafkaConsumerFactory;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.EntityDescriptor;
import com.indexsync.model.SyncEntity;
import com.indexsync.retry.BackoffPolicy;
import com.indexsync.retry.RetryEngine;
import com.indexsync.serde.ChangeEventDecoder;
import com.indexsync.status.HealthReport;
import com.indexsync.status.SyncHealthReporter;
import com.indexsync.status.SyncModeStatus;
import com.indexsync.sync.ChangeEventHandler;
import com.indexsync.sync.OperationDispatcher;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Wires every component for one entity and owns their lifecycle.
 *
 * <p>In {@link SyncMode#CUSTOM} mode the engine runs a {@link ConsumerGroupRunner}
 * on its own thread; in {@link SyncMode#KAFKA_CONNECT} mode an external sink
 * connector does the writing and the runner is stopped.  The index is
 * provisioned in both modes, and the alias is kept on the current month.</p>
 *
 * @param <T> the synchronised entity type
 */
@Slf4j
public class SyncEngine<T extends SyncEntity> implements Closeable {

    private final SyncConfig config;
    private final EntityDescriptor<T> descriptor;
    private final MetricsCollector metrics;
    private final IndexWriter writer;
    private final IndexNamer namer;
    private final IndexProvisioner provisioner;
    private final BulkBuffer bulkBuffer;
    private final FailureQueuePublisher failureQueue;
    private final ChangeEventHandler<T> handler;
    private final Supplier<Consumer<String, byte[]>> consumerSupplier;
    private final SyncHealthReporter healthReporter;

    private final SyncContext rootCtx = SyncContext.background();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "indexsync-maintenance");
        t.setDaemon(true);
        return t;
    });
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile SyncMode mode;
    private volatile ConsumerGroupRunner runner;
    private volatile Thread runnerThread;
    private volatile SyncException failure;

    /**
     * Builds an engine with real Elasticsearch and Kafka clients.
     */
    public SyncEngine(SyncConfig config, EntityDescriptor<T> descriptor, MetricsCollector metrics) {
        this(config, descriptor, metrics,
                new ElasticsearchIndexWriter(config.getElasticsearch()),
                new KafkaConsumerFactory(config.getKafka())::createConsumer,
                failureQueue(config, metrics),
                Clock.systemUTC());
    }

    public SyncEngine(SyncConfig config, EntityDescriptor<T> descriptor, MetricsCollector metrics,
                      IndexWriter writer, Supplier<Consumer<String, byte[]>> consumerSupplier,
                      FailureQueuePublisher failureQueue, Clock clock) {
        this.config = config;
        this.descriptor = descriptor;
        this.metrics = metrics;
        this.writer = writer;
        this.consumerSupplier = consumerSupplier;
        this.failureQueue = failureQueue;
        this.mode = config.getMode();

        SyncConfig.CustomSection custom = config.getCustom();
        String entityType = descriptor.getEntityType();
        Duration operationTimeout = Duration.ofMillis(custom.getOperationTimeoutMs());

        this.namer = new IndexNamer(config.getApp().getEnvironment(), config.getApp().getServiceName(),
                descriptor.getIndexEntity(), clock);
        this.provisioner = new IndexProvisioner(writer, namer, config.getElasticsearch(),
                descriptor.getTemplateName(), descriptor.getTemplateResource());

        RetryEngine retryEngine = new RetryEngine(BackoffPolicy.fromConfig(custom), metrics, entityType);
        OperationDispatcher<T> dispatcher = new OperationDispatcher<>(writer, namer, retryEngine, metrics,
                entityType, operationTimeout, clock);
        this.bulkBuffer = custom.isBulkEnabled()
                ? new BulkBuffer(writer, new BulkRequestEncoder(), metrics, entityType,
                        custom.getBatchSize(), operationTimeout, BackoffPolicy.fromConfig(custom), clock)
                : null;
        this.handler = new ChangeEventHandler<>(new ChangeEventDecoder<>(descriptor.getEntityClass()),
                dispatcher, failureQueue, metrics, bulkBuffer);
        this.healthReporter = new SyncHealthReporter(writer, this::isConsumerHealthy, clock);
    }

    private static FailureQueuePublisher failureQueue(SyncConfig config, MetricsCollector metrics) {
        String topic = config.getCustom().getFailureQueue();
        if (topic == null || topic.isBlank()) {
            return FailureQueuePublisher.disabled(metrics);
        }
        return new FailureQueuePublisher(new KafkaConsumerFactory(config.getKafka()).createProducer(), topic,
                metrics, Duration.ofMillis(config.getCustom().getOperationTimeoutMs()));
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /**
     * Validates configuration, provisions the index and starts the consumer
     * runner when in custom mode.  Returns once the runner thread is running.
     *
     * @throws SyncException {@code SYSTEM_CONFIG} for invalid configuration, or a
     *                       provisioning error; either leaves the engine unstarted
     */
    public void start() throws SyncException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("engine already started");
        }
        config.validate();
        metrics.init();
        log.info("Starting sync engine entity={} mode={} environment={}",
                descriptor.getEntityType(), mode, config.getApp().getEnvironment());

        provisioner.provision();

        long aliasRefresh = config.getElasticsearch().getAliasRefreshIntervalMs();
        scheduler.scheduleAtFixedRate(this::refreshAlias, aliasRefresh, aliasRefresh, TimeUnit.MILLISECONDS);
        if (bulkBuffer != null) {
            long flushInterval = config.getCustom().getBulkFlushIntervalMs();
            scheduler.scheduleAtFixedRate(this::flushBulk, flushInterval, flushInterval, TimeUnit.MILLISECONDS);
        }

        if (mode == SyncMode.CUSTOM) {
            startRunner();
        } else {
            log.info("Mode {} selected, consumer runner not started", mode);
        }
    }

    /**
     * Blocks until the engine is closed or its consumer runner fails.
     *
     * @throws SyncException the runner's failure, if that is what ended the wait
     */
    public void awaitTermination() throws SyncException, InterruptedException {
        terminated.await();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing sync engine entity={}", descriptor.getEntityType());
        scheduler.shutdownNow();
        stopRunner();
        flushBulk();
        rootCtx.cancel();
        failureQueue.close();
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close index writer: {}", e.getMessage());
        }
        metrics.cleanup();
        terminated.countDown();
    }

    // ── Mode & status ────────────────────────────────────────────────────

    public SyncMode getMode() {
        return mode;
    }

    /**
     * Switches between the custom consumer and the Kafka Connect sink.
     *
     * @throws SyncException {@code SYSTEM_CONFIG} when {@code target} is not enabled
     */
    public synchronized void switchMode(SyncMode target) throws SyncException {
        if (!isEnabled(target)) {
            throw new SyncException(ErrorCode.SYSTEM_CONFIG, "sync mode " + target + " is not enabled");
        }
        if (target == mode) {
            log.info("Already in mode={}", target);
            return;
        }
        log.info("Switching sync mode from={} to={}", mode, target);
        if (target == SyncMode.KAFKA_CONNECT) {
            stopRunner();
            flushBulk();
        }
        mode = target;
        if (target == SyncMode.CUSTOM && started.get() && !closed.get()) {
            startRunner();
        }
    }

    public SyncModeStatus modeStatus() {
        ConsumerGroupRunner current = runner;
        return SyncModeStatus.builder()
                .mode(mode)
                .enabled(isEnabled(mode))
                .currentIndex(namer.currentIndex())
                .consumerStatus(current != null ? current.getStatus() : null)
                .elasticsearch(writer.lastKnownHealth())
                .build();
    }

    public HealthReport health() {
        return healthReporter.report();
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public IndexNamer getNamer() {
        return namer;
    }

    // ── Internals ────────────────────────────────────────────────────────

    private boolean isEnabled(SyncMode target) {
        return switch (target) {
            case CUSTOM -> config.getCustom().isEnabled();
            case KAFKA_CONNECT -> config.getSync().getKafkaConnect().isEnabled();
        };
    }

    /** In Kafka Connect mode the consumer side is owned by the connector. */
    private boolean isConsumerHealthy() {
        if (mode != SyncMode.CUSTOM) {
            return true;
        }
        ConsumerGroupRunner current = runner;
        return current != null && current.isHealthy();
    }

    private synchronized void startRunner() {
        ConsumerGroupRunner fresh = new ConsumerGroupRunner(consumerSupplier, handler::handle,
                config.resolveTopics(descriptor.getTopicSuffix()),
                Duration.ofMillis(config.getKafka().getPollTimeoutMs()),
                Duration.ofMillis(config.getKafka().getRevokeGraceMs()),
                Duration.ofMillis(config.getKafka().getShutdownTimeoutMs()),
                bulkBuffer);
        Thread thread = new Thread(() -> {
            try {
                fresh.start();
            } catch (SyncException e) {
                log.error("Consumer runner terminated entity={}: {}", descriptor.getEntityType(), e.toString());
                failure = e;
                terminated.countDown();
            }
        }, "indexsync-runner-" + descriptor.getEntityType());
        runner = fresh;
        runnerThread = thread;
        thread.start();
    }

    private synchronized void stopRunner() {
        ConsumerGroupRunner current = runner;
        Thread thread = runnerThread;
        if (current == null) {
            return;
        }
        current.close();
        if (thread != null) {
            try {
                thread.join(config.getKafka().getShutdownTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Consumer runner stopped status={}", current.getStatus());
    }

    private void refreshAlias() {
        try {
            provisioner.refreshAlias();
        } catch (SyncException e) {
            log.error("Alias refresh failed alias={}: {}", namer.alias(), e.toString());
        }
    }

    private void flushBulk() {
        if (bulkBuffer == null) {
            return;
        }
        try {
            int flushed = bulkBuffer.flush(rootCtx);
            if (flushed > 0) {
                log.debug("Periodic bulk flush applied={}", flushed);
            }
        } catch (SyncException e) {
            log.warn("Periodic bulk flush failed: {}", e.getMessage());
        }
    }
}
