package com.indexsync;

import com.indexsync.config.SyncConfig;
import com.indexsync.config.SyncMode;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.kafka.FailureQueuePublisher;
import com.indexsync.kafka.RunnerStatus;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.EntityDescriptor;
import com.indexsync.status.ComponentStatus;
import com.indexsync.status.SyncModeStatus;
import com.indexsync.testing.ChangeEvents;
import com.indexsync.testing.InMemoryIndexWriter;
import com.indexsync.testing.TestEntity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("SyncEngine Tests")
class SyncEngineTest {

    private static final String TOPIC = "postgres.digital_discovery.public.tests";
    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
    private static final String ALIAS = "prod-digital-discovery-tests";
    private static final String INDEX = ALIAS + "-2025-04";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-04-15T10:00:00Z"), ZoneOffset.UTC);

    private static final EntityDescriptor<TestEntity> DESCRIPTOR = EntityDescriptor.<TestEntity>builder()
            .entityClass(TestEntity.class)
            .entityType("test")
            .indexEntity("tests")
            .topicSuffix("tests")
            .templateName("test-template")
            .templateResource("index-templates/test-template.json")
            .build();

    private SyncConfig config;
    private InMemoryIndexWriter writer;
    private MetricsCollector metrics;
    private MockConsumer<String, byte[]> consumer;
    private SyncEngine<TestEntity> engine;

    @BeforeEach
    void setUp() {
        config = new SyncConfig();
        config.getApp().setEnvironment("prod");
        config.getKafka().setBootstrapServers("localhost:9092");
        config.getKafka().setPollTimeoutMs(10);
        config.getKafka().setRevokeGraceMs(100);
        config.getKafka().setShutdownTimeoutMs(2000);
        config.getElasticsearch().setHosts(List.of("http://localhost:9200"));
        config.getCustom().setRetryDelayMs(0);
        config.getCustom().setMaxRetryDelayMs(0);

        writer = new InMemoryIndexWriter();
        metrics = new MetricsCollector(new SimpleMeterRegistry());
        consumer = newConsumer();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static MockConsumer<String, byte[]> newConsumer() {
        MockConsumer<String, byte[]> mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        mock.updateBeginningOffsets(Map.of(P0, 0L));
        return mock;
    }

    private SyncEngine<TestEntity> engine(FailureQueuePublisher failureQueue) {
        engine = new SyncEngine<>(config, DESCRIPTOR, metrics, writer, () -> consumer, failureQueue, CLOCK);
        return engine;
    }

    private void produceOnNextPoll(byte[]... values) {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(P0));
            for (int i = 0; i < values.length; i++) {
                consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, "k" + i, values[i]));
            }
        });
    }

    private static Map<String, Object> row(String id, String name, long rank) {
        return Map.of("id", id, "name", name, "rank", rank);
    }

    @Nested
    @DisplayName("Custom mode")
    class CustomMode {

        @Test
        @DisplayName("Provisions the index and applies consumed change events in order")
        void consumesAndApplies() throws SyncException {
            // Given
            produceOnNextPoll(
                    ChangeEvents.create(row("t1", "first", 1)),
                    ChangeEvents.update(row("t1", "second", 2)),
                    ChangeEvents.create(row("t2", "other", 3)),
                    ChangeEvents.delete(row("t2", "other", 3)));
            engine(FailureQueuePublisher.disabled(metrics));

            // When
            engine.start();

            // Then
            await().atMost(5, TimeUnit.SECONDS).until(() -> writer.writeLog().size() == 4);
            assertThat(writer.document(INDEX, "t1")).hasValueSatisfying(doc -> {
                assertThat(doc.get("name").asText()).isEqualTo("second");
                assertThat(doc.get("rank").asLong()).isEqualTo(2);
            });
            assertThat(writer.document(INDEX, "t2")).isEmpty();
            assertThat(writer.aliasIndices(ALIAS)).containsExactly(INDEX);
            assertThat(writer.template("test-template")).isNotNull();

            SyncModeStatus status = engine.modeStatus();
            assertThat(status.getMode()).isEqualTo(SyncMode.CUSTOM);
            assertThat(status.isEnabled()).isTrue();
            assertThat(status.getCurrentIndex()).isEqualTo(INDEX);
            assertThat(status.getConsumerStatus()).isEqualTo(RunnerStatus.RUNNING);
            assertThat(engine.health().isUp()).isTrue();
        }

        @Test
        @DisplayName("Invalid configuration keeps the engine from starting")
        void rejectsInvalidConfig() {
            config.getCustom().setBatchSize(0);
            engine(FailureQueuePublisher.disabled(metrics));

            assertThatThrownBy(engine::start)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SYSTEM_CONFIG));
            assertThat(writer.template("test-template")).isNull();
        }

        @Test
        @DisplayName("A second start is refused")
        void startOnce() throws SyncException {
            engine(FailureQueuePublisher.disabled(metrics)).start();

            assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("A failure-queue outage terminates the engine with a consumer error")
        void runnerFailureEndsAwait() throws SyncException {
            // Given a failure queue whose broker never acknowledges
            MockProducer<String, byte[]> producer =
                    new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
            FailureQueuePublisher failureQueue = new FailureQueuePublisher(producer, "failed-syncs", metrics,
                    Duration.ofMillis(50));
            produceOnNextPoll(ChangeEvents.json("not json"));
            engine(failureQueue).start();

            // When
            CompletableFuture<Throwable> terminated = CompletableFuture.supplyAsync(() -> {
                try {
                    engine.awaitTermination();
                    return null;
                } catch (SyncException | InterruptedException e) {
                    return e;
                }
            });

            // Then
            await().atMost(5, TimeUnit.SECONDS).until(terminated::isDone);
            assertThat(terminated.join())
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.KAFKA_CONSUMER));
            assertThat(engine.modeStatus().getConsumerStatus()).isEqualTo(RunnerStatus.ERROR);
            assertThat(engine.health().getKafka()).isEqualTo(ComponentStatus.DOWN);
        }
    }

    @Nested
    @DisplayName("Mode switching")
    class ModeSwitching {

        @Test
        @DisplayName("Switching to a disabled mode is rejected")
        void rejectsDisabledMode() throws SyncException {
            engine(FailureQueuePublisher.disabled(metrics)).start();

            assertThatThrownBy(() -> engine.switchMode(SyncMode.KAFKA_CONNECT))
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SYSTEM_CONFIG));
            assertThat(engine.getMode()).isEqualTo(SyncMode.CUSTOM);
        }

        @Test
        @DisplayName("Switching to Kafka Connect stops the consumer and back again starts a new one")
        void switchesBothWays() throws SyncException {
            // Given
            config.getSync().getKafkaConnect().setEnabled(true);
            engine(FailureQueuePublisher.disabled(metrics)).start();
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> engine.modeStatus().getConsumerStatus() == RunnerStatus.RUNNING);

            // When
            engine.switchMode(SyncMode.KAFKA_CONNECT);

            // Then
            assertThat(engine.getMode()).isEqualTo(SyncMode.KAFKA_CONNECT);
            assertThat(engine.modeStatus().getConsumerStatus()).isEqualTo(RunnerStatus.CLOSED);
            assertThat(consumer.closed()).isTrue();
            assertThat(engine.health().getKafka()).isEqualTo(ComponentStatus.UP);

            // When switching back with a fresh consumer
            consumer = newConsumer();
            engine.switchMode(SyncMode.CUSTOM);

            // Then
            await().atMost(5, TimeUnit.SECONDS)
                    .until(() -> engine.modeStatus().getConsumerStatus() == RunnerStatus.RUNNING);
        }

        @Test
        @DisplayName("Starting in Kafka Connect mode provisions but does not consume")
        void kafkaConnectModeDoesNotConsume() throws SyncException {
            config.getSync().setMode(SyncMode.KAFKA_CONNECT);
            config.getSync().getKafkaConnect().setEnabled(true);

            engine(FailureQueuePublisher.disabled(metrics)).start();

            assertThat(writer.aliasIndices(ALIAS)).containsExactly(INDEX);
            assertThat(engine.modeStatus().getConsumerStatus()).isNull();
            assertThat(consumer.subscription()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("close releases awaitTermination and is idempotent")
        void closeReleasesAwait() throws Exception {
            engine(FailureQueuePublisher.disabled(metrics)).start();
            CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> {
                try {
                    engine.awaitTermination();
                } catch (SyncException | InterruptedException e) {
                    throw new IllegalStateException(e);
                }
            });

            engine.close();
            engine.close();

            waiting.get(5, TimeUnit.SECONDS);
            assertThat(engine.modeStatus().getConsumerStatus()).isEqualTo(RunnerStatus.CLOSED);
        }
    }
}
