package com.indexsync.elasticsearch;

import com.indexsync.error.SyncException;
import com.indexsync.sync.SyncContext;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Everything the engine asks of the search cluster.
 *
 * <p>Write methods honour the {@link SyncContext}: they fail with {@code ES_TIMEOUT}
 * once its deadline passes and with {@code OPERATION_CANCELLED} when it is cancelled,
 * aborting the in-flight request.  Failures are classified into
 * {@link com.indexsync.error.ErrorCode}s so callers only branch on
 * {@link SyncException#isRetryable()}.</p>
 */
public interface IndexWriter extends Closeable {

    // ── Document writes ──────────────────────────────────────────────────

    /** Indexes the full document under {@code id}, replacing any previous version. */
    void index(SyncContext ctx, String index, String id, Object document) throws SyncException;

    /** Merges {@code partial} into the document, creating it when absent. */
    void upsert(SyncContext ctx, String index, String id, Object partial) throws SyncException;

    /** Deletes the document.  A missing document or index counts as success. */
    void delete(SyncContext ctx, String index, String id) throws SyncException;

    /**
     * Submits an NDJSON bulk body.
     *
     * @return the actions the cluster did not apply, in body order; empty when all applied
     * @throws SyncException when the request as a whole failed, in which case nothing is
     *                       known to have been applied
     */
    List<BulkItemFailure> bulk(SyncContext ctx, String ndjson, int operationCount) throws SyncException;

    // ── Health ───────────────────────────────────────────────────────────

    /** Probes the cluster and remembers the answer. */
    ClusterHealth checkHealth();

    /** Result of the most recent {@link #checkHealth()}. */
    ClusterHealth lastKnownHealth();

    // ── Provisioning ─────────────────────────────────────────────────────

    boolean lifecyclePolicyExists(String name) throws SyncException;

    void putLifecyclePolicy(String name, String policyJson) throws SyncException;

    boolean indexTemplateExists(String name) throws SyncException;

    void putIndexTemplate(String name, String templateJson) throws SyncException;

    boolean indexExists(String index) throws SyncException;

    /** Creates the index; an index that already exists is not an error. */
    void createIndex(String index) throws SyncException;

    /** Indices the alias currently points at; empty when the alias does not exist. */
    Set<String> aliasIndices(String alias) throws SyncException;

    /**
     * Atomically points {@code alias} at {@code index} (as its write index) and
     * removes it from {@code removeFrom}.
     */
    void moveAlias(String alias, String index, Collection<String> removeFrom) throws SyncException;
}
