package com.indexsync.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Top-level synchronisation engine configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * under the {@code indexsync.*} prefix.  The static {@link #load(String)} and
 * {@link #loadFromClasspath(String)} helpers serve the standalone job and tests.</p>
 */
@Data
@ConfigurationProperties(prefix = "indexsync")
public class SyncConfig {

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private AppSection app = new AppSection();
    private KafkaSection kafka = new KafkaSection();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private SyncSection sync = new SyncSection();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static SyncConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), SyncConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static SyncConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = SyncConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, SyncConfig.class);
        }
    }

    // ── Validation ───────────────────────────────────────────────────────

    /**
     * Rejects configurations the engine cannot run with.
     *
     * @throws SyncException with {@code SYSTEM_CONFIG} naming the offending setting
     */
    public void validate() throws SyncException {
        if (elasticsearch.getHosts() == null || elasticsearch.getHosts().isEmpty()) {
            throw configError("elasticsearch.hosts must not be empty");
        }
        if (isBlank(kafka.getBootstrapServers())) {
            throw configError("kafka.bootstrapServers must be set");
        }
        if (isBlank(kafka.getGroupId())) {
            throw configError("kafka.groupId must be set");
        }
        CustomSection custom = sync.getCustom();
        if (custom.getBatchSize() <= 0) {
            throw configError("sync.custom.batchSize must be positive, was " + custom.getBatchSize());
        }
        if (custom.getMaxRetries() < 0) {
            throw configError("sync.custom.maxRetries must not be negative, was " + custom.getMaxRetries());
        }
        if (custom.getBackoffFactor() < 1.0) {
            throw configError("sync.custom.backoffFactor must be >= 1, was " + custom.getBackoffFactor());
        }
        if (custom.getRetryDelayMs() < 0 || custom.getMaxRetryDelayMs() < custom.getRetryDelayMs()) {
            throw configError("sync.custom retry delays must satisfy 0 <= retryDelayMs <= maxRetryDelayMs");
        }
        if (custom.getOperationTimeoutMs() <= 0) {
            throw configError("sync.custom.operationTimeoutMs must be positive");
        }
    }

    private static SyncException configError(String message) {
        return new SyncException(ErrorCode.SYSTEM_CONFIG, message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public SyncMode getMode() {
        return sync.getMode();
    }

    public CustomSection getCustom() {
        return sync.getCustom();
    }

    /**
     * Topics to subscribe: the explicit {@code kafka.topics} list when set,
     * otherwise {@code {topicPrefix}.{topicSuffix}}.
     */
    public List<String> resolveTopics(String topicSuffix) {
        if (kafka.getTopics() != null && !kafka.getTopics().isEmpty()) {
            return kafka.getTopics();
        }
        return List.of(kafka.getTopicPrefix() + "." + topicSuffix);
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class AppSection {
        private String environment = "development";
        private String serviceName = "digital-discovery";
        private String version = "1.0.0";
    }

    @Data
    public static class KafkaSection {
        private String bootstrapServers;
        private String groupId = "digital-discovery-sync";
        private String topicPrefix = "postgres.digital_discovery.public";
        private List<String> topics;
        private String autoOffsetReset = "earliest";
        private long pollTimeoutMs = 500;
        private int maxPollRecords = 500;
        /** Time a revoked partition's worker gets to finish before it is cancelled. */
        private long revokeGraceMs = 5000;
        private long shutdownTimeoutMs = 30_000;
        private boolean securityEnabled;
        private String saslUsername;
        private String saslPassword;
    }

    @Data
    public static class SyncSection {
        private SyncMode mode = SyncMode.CUSTOM;
        private KafkaConnectSection kafkaConnect = new KafkaConnectSection();
        private CustomSection custom = new CustomSection();
    }

    @Data
    public static class KafkaConnectSection {
        private boolean enabled;
        private String url = "http://localhost:8083";
        private String name = "elasticsearch-sink";
        private String topicPrefix = "postgres.digital_discovery.public";
    }

    @Data
    public static class CustomSection {
        private boolean enabled = true;
        private int batchSize = 100;
        private boolean bulkEnabled;
        private long bulkFlushIntervalMs = 1000;
        private int maxRetries = 3;
        private long retryDelayMs = 5000;
        private long maxRetryDelayMs = 3_600_000;
        private double backoffFactor = 2.0;
        /** Per-attempt deadline of a single index write. */
        private long operationTimeoutMs = 10_000;
        /** Dead-letter topic for terminal failures; blank disables dead-lettering. */
        private String failureQueue = "failed-syncs";
    }
}
