package com.indexsync.status;

import com.indexsync.elasticsearch.ClusterHealth;
import com.indexsync.elasticsearch.IndexWriter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.function.BooleanSupplier;

/**
 * Builds {@link HealthReport}s by probing the cluster and asking the consumer
 * side whether it is healthy.
 */
@Slf4j
public class SyncHealthReporter {

    private final IndexWriter writer;
    private final BooleanSupplier kafkaHealthy;
    private final Clock clock;

    public SyncHealthReporter(IndexWriter writer, BooleanSupplier kafkaHealthy, Clock clock) {
        this.writer = writer;
        this.kafkaHealthy = kafkaHealthy;
        this.clock = clock;
    }

    public HealthReport report() {
        ClusterHealth health = writer.checkHealth();
        ComponentStatus elasticsearch = health.isUp() ? ComponentStatus.UP : ComponentStatus.DOWN;
        ComponentStatus kafka = kafkaHealthy.getAsBoolean() ? ComponentStatus.UP : ComponentStatus.DOWN;
        ComponentStatus overall = elasticsearch == ComponentStatus.UP && kafka == ComponentStatus.UP
                ? ComponentStatus.UP : ComponentStatus.DOWN;
        if (overall == ComponentStatus.DOWN) {
            log.warn("Health degraded elasticsearch={} cluster={} kafka={}", elasticsearch, health, kafka);
        }
        return HealthReport.builder()
                .status(overall)
                .elasticsearch(elasticsearch)
                .kafka(kafka)
                .timestamp(clock.instant())
                .build();
    }
}
