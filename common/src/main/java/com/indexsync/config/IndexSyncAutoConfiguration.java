package com.indexsync.config;

import com.indexsync.SyncEngine;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.EntityDescriptor;
import com.indexsync.model.SyncEntity;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires the sync engine beans.
 *
 * <p>Discovered via component-scanning from each domain {@code @SpringBootApplication}
 * (which scans {@code com.indexsync.*}).  The domain module contributes the
 * {@link EntityDescriptor} bean; the engine is created unstarted and closed with
 * the context.</p>
 */
@Configuration
@EnableConfigurationProperties(SyncConfig.class)
public class IndexSyncAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MetricsCollector metricsCollector(ObjectProvider<MeterRegistry> registry) {
        return new MetricsCollector(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(EntityDescriptor.class)
    @ConditionalOnMissingBean
    public SyncEngine<?> syncEngine(SyncConfig config, EntityDescriptor<?> descriptor, MetricsCollector metrics) {
        return createEngine(config, descriptor, metrics);
    }

    private static <T extends SyncEntity> SyncEngine<T> createEngine(SyncConfig config, EntityDescriptor<T> descriptor,
                                                                     MetricsCollector metrics) {
        return new SyncEngine<>(config, descriptor, metrics);
    }
}
