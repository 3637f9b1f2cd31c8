package com.indexsync.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indexsync.config.ElasticsearchConfig;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.serde.JsonMappers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Prepares the cluster for one entity: lifecycle policy, index template, the
 * current monthly index and the alias pointing at it.
 *
 * <p>Every step checks before it creates, so running it again is harmless.  The
 * engine calls {@link #refreshAlias()} periodically to follow month rotation.</p>
 */
@Slf4j
public class IndexProvisioner {

    static final String LIFECYCLE_POLICY_RESOURCE = "lifecycle/default-lifecycle-policy.json";

    private final IndexWriter writer;
    private final IndexNamer namer;
    private final ElasticsearchConfig config;
    private final String templateName;
    private final String templateResource;
    private final ObjectMapper objectMapper = JsonMappers.create();

    public IndexProvisioner(IndexWriter writer, IndexNamer namer, ElasticsearchConfig config,
                            String templateName, String templateResource) {
        this.writer = writer;
        this.namer = namer;
        this.config = config;
        this.templateName = templateName;
        this.templateResource = templateResource;
    }

    public void provision() throws SyncException {
        log.info("Provisioning alias={} index={}", namer.alias(), namer.currentIndex());
        ensureLifecyclePolicy();
        ensureIndexTemplate();
        refreshAlias();
    }

    /**
     * Creates the current month's index if needed and points the alias at it.
     *
     * @return the index the alias points at
     */
    public String refreshAlias() throws SyncException {
        String index = namer.currentIndex();
        String alias = namer.alias();
        try {
            if (!writer.indexExists(index)) {
                writer.createIndex(index);
                log.info("Created index={}", index);
            }
        } catch (SyncException e) {
            throw provisioningError(ErrorCode.ES_SETUP, "cannot create index " + index, e);
        }

        try {
            Set<String> current = writer.aliasIndices(alias);
            if (current.size() == 1 && current.contains(index)) {
                return index;
            }
            writer.moveAlias(alias, index, current);
            log.info("Alias moved alias={} index={} previous={}", alias, index, current);
            return index;
        } catch (SyncException e) {
            throw provisioningError(ErrorCode.ES_ALIAS, "cannot point alias " + alias + " at " + index, e);
        }
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void ensureLifecyclePolicy() throws SyncException {
        String policy = config.getLifecyclePolicy();
        try {
            if (writer.lifecyclePolicyExists(policy)) {
                log.debug("Lifecycle policy exists name={}", policy);
                return;
            }
            JsonNode body = readResource(LIFECYCLE_POLICY_RESOURCE, ErrorCode.ES_LIFECYCLE);
            writer.putLifecyclePolicy(policy, objectMapper.writeValueAsString(body));
            log.info("Created lifecycle policy name={}", policy);
        } catch (SyncException e) {
            throw provisioningError(ErrorCode.ES_LIFECYCLE, "cannot create lifecycle policy " + policy, e);
        } catch (IOException e) {
            throw new SyncException(ErrorCode.ES_LIFECYCLE, "cannot encode lifecycle policy " + policy, e);
        }
    }

    private void ensureIndexTemplate() throws SyncException {
        try {
            if (writer.indexTemplateExists(templateName)) {
                log.debug("Index template exists name={}", templateName);
                return;
            }
            writer.putIndexTemplate(templateName, templateBody());
            log.info("Created index template name={} pattern={}-*", templateName, namer.alias());
        } catch (SyncException e) {
            throw provisioningError(ErrorCode.ES_TEMPLATE, "cannot create index template " + templateName, e);
        }
    }

    /** The entity's template with patterns, shards, replicas and lifecycle filled in. */
    String templateBody() throws SyncException {
        JsonNode resource = readResource(templateResource, ErrorCode.ES_TEMPLATE);
        if (!resource.isObject()) {
            throw new SyncException(ErrorCode.ES_TEMPLATE, templateResource + " is not a JSON object");
        }
        ObjectNode template = (ObjectNode) resource;
        template.putArray("index_patterns").add(namer.alias() + "-*");
        ObjectNode index = template.withObject("/template/settings/index");
        index.put("number_of_shards", config.getShardCount());
        index.put("number_of_replicas", config.getReplicaCount());
        index.withObject("/lifecycle").put("name", config.getLifecyclePolicy());
        try {
            return objectMapper.writeValueAsString(template);
        } catch (IOException e) {
            throw new SyncException(ErrorCode.ES_TEMPLATE, "cannot encode index template " + templateName, e);
        }
    }

    private JsonNode readResource(String resource, ErrorCode code) throws SyncException {
        try (InputStream in = IndexProvisioner.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new SyncException(code, "classpath resource not found: " + resource);
            }
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new SyncException(code, "cannot read " + resource + ": " + e.getMessage(), e);
        }
    }

    private static SyncException provisioningError(ErrorCode code, String message, SyncException cause) {
        if (cause.getErrorCode() == code) {
            return cause;
        }
        return new SyncException(code, message + ": " + cause.getMessage(), cause);
    }
}
