package com.indexsync.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexsync.config.ElasticsearchConfig;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.testing.InMemoryIndexWriter;
import com.indexsync.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexProvisioner Tests")
class IndexProvisionerTest {

    private static final String TEMPLATE = "test-template";
    private static final String TEMPLATE_RESOURCE = "index-templates/test-template.json";
    private static final String ALIAS = "prod-digital-discovery-categories";

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private IndexWriter failingWriter;

    private InMemoryIndexWriter writer;
    private MutableClock clock;
    private IndexNamer namer;
    private ElasticsearchConfig config;

    @BeforeEach
    void setUp() {
        writer = new InMemoryIndexWriter();
        clock = new MutableClock(Instant.parse("2025-04-15T10:00:00Z"));
        namer = new IndexNamer("prod", "digital-discovery", "categories", clock);
        config = new ElasticsearchConfig();
        config.setShardCount(2);
        config.setReplicaCount(1);
        config.setLifecyclePolicy("digital-discovery-policy");
    }

    private IndexProvisioner provisioner(IndexWriter target) {
        return new IndexProvisioner(target, namer, config, TEMPLATE, TEMPLATE_RESOURCE);
    }

    @Nested
    @DisplayName("Provisioning")
    class Provisioning {

        @Test
        @DisplayName("Creates policy, template, monthly index and alias")
        void provisionsEverything() throws Exception {
            // When
            provisioner(writer).provision();

            // Then
            JsonNode policy = mapper.readTree(writer.lifecyclePolicy("digital-discovery-policy"));
            assertThat(policy.at("/policy/phases/delete/min_age").asText()).isEqualTo("90d");

            JsonNode template = mapper.readTree(writer.template(TEMPLATE));
            assertThat(template.at("/index_patterns/0").asText()).isEqualTo(ALIAS + "-*");
            assertThat(template.at("/template/settings/index/number_of_shards").asInt()).isEqualTo(2);
            assertThat(template.at("/template/settings/index/number_of_replicas").asInt()).isEqualTo(1);
            assertThat(template.at("/template/settings/index/lifecycle/name").asText())
                    .isEqualTo("digital-discovery-policy");
            assertThat(template.at("/template/settings/index/refresh_interval").asText()).isEqualTo("1s");
            assertThat(template.at("/template/mappings/properties/rank/type").asText()).isEqualTo("long");

            assertThat(writer.indexExists(ALIAS + "-2025-04")).isTrue();
            assertThat(writer.aliasIndices(ALIAS)).containsExactly(ALIAS + "-2025-04");
        }

        @Test
        @DisplayName("Running twice changes nothing")
        void idempotent() throws SyncException {
            IndexProvisioner provisioner = provisioner(writer);
            provisioner.provision();
            String template = writer.template(TEMPLATE);

            provisioner.provision();

            assertThat(writer.template(TEMPLATE)).isEqualTo(template);
            assertThat(writer.aliasIndices(ALIAS)).containsExactly(ALIAS + "-2025-04");
        }

        @Test
        @DisplayName("An existing template is left untouched")
        void keepsExistingTemplate() throws SyncException {
            writer.putIndexTemplate(TEMPLATE, "{\"custom\":true}");

            provisioner(writer).provision();

            assertThat(writer.template(TEMPLATE)).isEqualTo("{\"custom\":true}");
        }

        @Test
        @DisplayName("A missing template resource is a template error")
        void missingTemplateResource() {
            IndexProvisioner provisioner = new IndexProvisioner(writer, namer, config, TEMPLATE,
                    "index-templates/absent.json");

            assertThatThrownBy(provisioner::provision)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ES_TEMPLATE))
                    .hasMessageContaining("absent.json");
        }
    }

    @Nested
    @DisplayName("Alias rotation")
    class AliasRotation {

        @Test
        @DisplayName("Moves the alias to the new month's index")
        void movesAliasOnNewMonth() throws SyncException {
            // Given
            IndexProvisioner provisioner = provisioner(writer);
            provisioner.provision();

            // When
            clock.set(Instant.parse("2025-05-01T00:00:05Z"));
            String current = provisioner.refreshAlias();

            // Then
            assertThat(current).isEqualTo(ALIAS + "-2025-05");
            assertThat(writer.indexExists(ALIAS + "-2025-05")).isTrue();
            assertThat(writer.indexExists(ALIAS + "-2025-04")).isTrue();
            assertThat(writer.aliasIndices(ALIAS)).containsExactly(ALIAS + "-2025-05");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A cluster error while checking the policy surfaces as a lifecycle error")
        void lifecycleFailure() throws SyncException {
            when(failingWriter.lifecyclePolicyExists(anyString()))
                    .thenThrow(new SyncException(ErrorCode.ES_CONNECTION, "connection refused"));

            assertThatThrownBy(provisioner(failingWriter)::provision)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ES_LIFECYCLE))
                    .hasMessageContaining("connection refused");
            verify(failingWriter, never()).putIndexTemplate(anyString(), anyString());
        }

        @Test
        @DisplayName("An alias update failure surfaces as an alias error")
        void aliasFailure() throws SyncException {
            when(failingWriter.indexExists(ALIAS + "-2025-04")).thenReturn(true);
            when(failingWriter.aliasIndices(ALIAS)).thenReturn(Set.of());
            doThrow(new SyncException(ErrorCode.ES_INDEX, "status 503"))
                    .when(failingWriter).moveAlias(ALIAS, ALIAS + "-2025-04", Set.of());

            assertThatThrownBy(provisioner(failingWriter)::refreshAlias)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ES_ALIAS));
        }
    }
}
