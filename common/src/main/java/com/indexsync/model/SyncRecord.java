package com.indexsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one synchronisation attempt sequence for a single entity.
 *
 * <p>Produced by the dispatcher and logged when the sequence terminates.</p>
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncRecord {

    private String id;
    @JsonProperty("entity_type")
    private String entityType;
    @JsonProperty("entity_id")
    private String entityId;
    private OperationType operation;
    private SyncStatus status;
    @JsonProperty("error_message")
    private String errorMessage;
    @JsonProperty("retry_count")
    private int retryCount;
    @JsonProperty("last_retry")
    private Instant lastRetryAt;
    @JsonProperty("next_retry")
    private Instant nextRetryAt;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static SyncRecord pending(String entityType, String entityId, OperationType operation) {
        SyncRecord record = new SyncRecord();
        Instant now = Instant.now();
        record.id = UUID.randomUUID().toString();
        record.entityType = entityType;
        record.entityId = entityId;
        record.operation = operation;
        record.status = SyncStatus.PENDING;
        record.createdAt = now;
        record.updatedAt = now;
        return record;
    }

    public void markRetrying() {
        Instant now = Instant.now();
        status = SyncStatus.RETRYING;
        retryCount++;
        lastRetryAt = now;
        updatedAt = now;
    }

    public void markFailed(String error, Duration retryDelay) {
        Instant now = Instant.now();
        status = SyncStatus.FAILED;
        errorMessage = error;
        lastRetryAt = now;
        nextRetryAt = retryDelay != null ? now.plus(retryDelay) : null;
        updatedAt = now;
    }

    public void markSuccess() {
        status = SyncStatus.SUCCESS;
        errorMessage = null;
        lastRetryAt = null;
        nextRetryAt = null;
        updatedAt = Instant.now();
    }
}
