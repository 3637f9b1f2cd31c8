package com.indexsync.kafka;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.SourcePosition;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes records that failed terminally to the failure queue topic.
 *
 * <p>The original key and value are kept; the failure is described in headers
 * so the record can be inspected and replayed.  A publisher built without a
 * topic is disabled and drops nothing on the floor: callers check
 * {@link #isEnabled()} and acknowledge the record themselves.</p>
 */
@Slf4j
public class FailureQueuePublisher implements Closeable {

    public static final String HEADER_ERROR_CODE = "error.code";
    public static final String HEADER_ERROR_KIND = "error.kind";
    public static final String HEADER_ERROR_MESSAGE = "error.message";
    public static final String HEADER_SOURCE_TOPIC = "source.topic";
    public static final String HEADER_SOURCE_PARTITION = "source.partition";
    public static final String HEADER_SOURCE_OFFSET = "source.offset";

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final MetricsCollector metrics;
    private final Duration sendTimeout;

    public FailureQueuePublisher(Producer<String, byte[]> producer, String topic,
                                 MetricsCollector metrics, Duration sendTimeout) {
        this.producer = producer;
        this.topic = topic;
        this.metrics = metrics;
        this.sendTimeout = sendTimeout;
    }

    public static FailureQueuePublisher disabled(MetricsCollector metrics) {
        return new FailureQueuePublisher(null, null, metrics, Duration.ZERO);
    }

    public boolean isEnabled() {
        return producer != null && topic != null && !topic.isBlank();
    }

    public String getTopic() {
        return topic;
    }

    /**
     * Publishes {@code record} with the failure attached and waits for the broker ack.
     *
     * @throws SyncException {@code DEAD_LETTER_PUBLISH} when the broker did not ack in time
     */
    public void publish(ConsumerRecord<String, byte[]> record, SyncException error) throws SyncException {
        publish(new SourcePosition(record.topic(), record.partition(), record.offset()),
                record.key(), record.value(), error);
    }

    /**
     * Publishes a record known only by its position, key and value, as kept by a
     * buffered write.
     *
     * @throws SyncException {@code DEAD_LETTER_PUBLISH} when the broker did not ack in time
     */
    public void publish(SourcePosition source, String key, byte[] value, SyncException error) throws SyncException {
        if (!isEnabled()) {
            return;
        }
        ProducerRecord<String, byte[]> failed = new ProducerRecord<>(topic, key, value);
        failed.headers()
                .add(HEADER_ERROR_CODE, bytes(error.getErrorCode().getCode()))
                .add(HEADER_ERROR_KIND, bytes(error.getKind().name()))
                .add(HEADER_ERROR_MESSAGE, bytes(String.valueOf(error.getMessage())))
                .add(HEADER_SOURCE_TOPIC, bytes(source.getTopic()))
                .add(HEADER_SOURCE_PARTITION, bytes(String.valueOf(source.getPartition())))
                .add(HEADER_SOURCE_OFFSET, bytes(String.valueOf(source.getOffset())));

        try {
            producer.send(failed).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw publishFailure(source, e);
        } catch (ExecutionException | TimeoutException e) {
            throw publishFailure(source, e);
        }
        metrics.recordDeadLetter();
        log.warn("Published to failure queue topic={} source={} code={}",
                topic, source, error.getErrorCode().getCode());
    }

    @Override
    public void close() {
        if (producer != null) {
            producer.close(Duration.ofSeconds(5));
        }
    }

    private SyncException publishFailure(SourcePosition source, Exception cause) {
        Throwable root = cause instanceof ExecutionException && cause.getCause() != null ? cause.getCause() : cause;
        log.error("Failed to publish to failure queue topic={} source={}", topic, source, root);
        return new SyncException(ErrorCode.DEAD_LETTER_PUBLISH,
                "cannot publish " + source + " to " + topic + ": " + root.getMessage(), root);
    }

    private static byte[] bytes(String value) {
        return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
    }
}
