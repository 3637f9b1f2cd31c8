package com.indexsync;

import com.indexsync.config.SyncConfig;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.model.EntityDescriptor;
import com.indexsync.model.SyncEntity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base for domain-specific sync jobs.
 *
 * <p>Subclasses only need to provide the default config resource name and the
 * entity descriptor. The engine is fully generic and is driven by the YAML
 * configuration.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class CategoriesSyncJob extends IndexSyncJobBase&lt;Category&gt; {
 *       protected String getDefaultConfigResource() { return "sync-config.yaml"; }
 *       protected EntityDescriptor&lt;Category&gt; getDescriptor() { return CategoryEntities.CATEGORY; }
 *       public static void main(String[] args) throws Exception { new CategoriesSyncJob().run(args); }
 *   }
 * </pre>
 *
 * @param <T> the synchronised entity type
 */
@Slf4j
public abstract class IndexSyncJobBase<T extends SyncEntity> {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    protected abstract EntityDescriptor<T> getDescriptor();

    /**
     * Loads configuration, starts the engine and blocks until it terminates.
     *
     * @param args optional single argument: path to a YAML config file
     */
    public void run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        SyncConfig config;
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            config = SyncConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = SyncConfig.loadFromClasspath(resource);
        }

        EntityDescriptor<T> descriptor = getDescriptor();
        log.info("Sync mode: {}", config.getMode());
        log.info("Entity: {} topics={}", descriptor.getEntityType(),
                config.resolveTopics(descriptor.getTopicSuffix()));

        // ── Start engine ─────────────────────────────────────────────────
        SyncEngine<T> engine = new SyncEngine<>(config, descriptor, new MetricsCollector(new SimpleMeterRegistry()));
        Runtime.getRuntime().addShutdownHook(new Thread(engine::close, "indexsync-shutdown"));
        try {
            engine.start();
            engine.awaitTermination();
        } finally {
            engine.close();
        }
    }
}
