package com.indexsync.config;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SyncConfig Tests")
class SyncConfigTest {

    private static SyncConfig valid() {
        SyncConfig config = new SyncConfig();
        config.getKafka().setBootstrapServers("localhost:9092");
        config.getElasticsearch().setHosts(List.of("http://localhost:9200"));
        return config;
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Binds every section from a classpath YAML resource")
        void loadsFromClasspath() throws IOException {
            SyncConfig config = SyncConfig.loadFromClasspath("sync-config-test.yaml");

            assertThat(config.getApp().getEnvironment()).isEqualTo("prod");
            assertThat(config.getKafka().getGroupId()).isEqualTo("test-sync");
            assertThat(config.getKafka().getPollTimeoutMs()).isEqualTo(20);
            assertThat(config.getElasticsearch().getHosts()).containsExactly("http://es-1:9200", "http://es-2:9200");
            assertThat(config.getElasticsearch().getLifecyclePolicy()).isEqualTo("test-policy");
            assertThat(config.getCustom().getBatchSize()).isEqualTo(50);
            assertThat(config.getCustom().isBulkEnabled()).isTrue();
            assertThat(config.getCustom().getBackoffFactor()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Parses the sync mode case-insensitively")
        void modeIsCaseInsensitive() throws IOException {
            SyncConfig config = SyncConfig.loadFromClasspath("sync-config-test.yaml");

            assertThat(config.getMode()).isEqualTo(SyncMode.KAFKA_CONNECT);
            assertThat(config.getSync().getKafkaConnect().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("Keeps defaults for settings the file leaves out")
        void keepsDefaults(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("minimal.yaml");
            Files.writeString(file, "kafka:\n  bootstrapServers: \"localhost:9092\"\n", StandardCharsets.UTF_8);

            SyncConfig config = SyncConfig.load(file.toString());

            assertThat(config.getMode()).isEqualTo(SyncMode.CUSTOM);
            assertThat(config.getCustom().getMaxRetries()).isEqualTo(3);
            assertThat(config.getCustom().getFailureQueue()).isEqualTo("failed-syncs");
            assertThat(config.getElasticsearch().getShardCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Fails with a clear message for a missing resource")
        void missingResource() {
            assertThatThrownBy(() -> SyncConfig.loadFromClasspath("does-not-exist.yaml"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Accepts the defaults once hosts and brokers are set")
        void acceptsDefaults() {
            assertThatCode(() -> valid().validate()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Rejects an empty host list")
        void rejectsMissingHosts() {
            SyncConfig config = valid();
            config.getElasticsearch().setHosts(List.of());

            assertThatThrownBy(config::validate)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SYSTEM_CONFIG))
                    .hasMessageContaining("elasticsearch.hosts");
        }

        @Test
        @DisplayName("Rejects a non-positive batch size")
        void rejectsBatchSize() {
            SyncConfig config = valid();
            config.getCustom().setBatchSize(0);

            assertThatThrownBy(config::validate).hasMessageContaining("batchSize");
        }

        @Test
        @DisplayName("Rejects a backoff factor below one")
        void rejectsBackoffFactor() {
            SyncConfig config = valid();
            config.getCustom().setBackoffFactor(0.5);

            assertThatThrownBy(config::validate).hasMessageContaining("backoffFactor");
        }

        @Test
        @DisplayName("Rejects a base delay above the delay cap")
        void rejectsInvertedDelays() {
            SyncConfig config = valid();
            config.getCustom().setRetryDelayMs(10_000);
            config.getCustom().setMaxRetryDelayMs(1_000);

            assertThatThrownBy(config::validate).hasMessageContaining("retryDelayMs");
        }

        @Test
        @DisplayName("Rejects missing brokers")
        void rejectsMissingBrokers() {
            SyncConfig config = valid();
            config.getKafka().setBootstrapServers(" ");

            assertThatThrownBy(config::validate).hasMessageContaining("bootstrapServers");
        }
    }

    @Nested
    @DisplayName("Topic resolution")
    class TopicResolution {

        @Test
        @DisplayName("Derives the topic from the prefix and entity suffix")
        void derivesTopic() {
            assertThat(valid().resolveTopics("categories"))
                    .containsExactly("postgres.digital_discovery.public.categories");
        }

        @Test
        @DisplayName("Explicit topics win over the derived one")
        void explicitTopicsWin() {
            SyncConfig config = valid();
            config.getKafka().setTopics(List.of("cdc.categories.v2"));

            assertThat(config.resolveTopics("categories")).containsExactly("cdc.categories.v2");
        }
    }
}
