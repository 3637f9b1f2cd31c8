package com.indexsync.model;

import com.indexsync.error.SyncException;

import java.time.Instant;

/**
 * Contract every synchronised document type implements.
 *
 * <p>The engine is generic over this type: it decodes change envelopes into it,
 * validates it, stamps it as synced and writes it to the index under
 * {@link #getId()}.</p>
 */
public interface SyncEntity {

    /** Document id, used verbatim as the Elasticsearch {@code _id}. */
    String getId();

    /**
     * Checks the entity's own business rules.
     *
     * @throws SyncException with {@code VALIDATION_FAILED} when a rule is violated
     */
    void validate() throws SyncException;

    /**
     * Marks the entity as successfully synchronised at the given instant.
     * Called right before the write is issued.
     */
    void markSynced(Instant at);
}
