package com.indexsync.categories.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.model.SyncEntity;
import com.indexsync.model.SyncStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for a product category row, as captured from the
 * {@code categories} table and indexed into the category indices.
 *
 * <p>Example: the row {@code {id: "c1", name: "Pulsa", status: 1}} becomes the
 * document {@code c1} with {@code sync_status = "SUCCESS"} once written.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Category implements SyncEntity {

    private String id;
    private String name;
    private String description;
    private long status;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;
    private long version;
    @JsonProperty("sync_status")
    private SyncStatus syncStatus;
    @JsonProperty("last_sync")
    private Instant lastSyncedAt;

    @Override
    public void validate() throws SyncException {
        if (name == null || name.isEmpty()) {
            throw new SyncException(ErrorCode.VALIDATION_FAILED, "name is required");
        }
        if (status < 0) {
            throw new SyncException(ErrorCode.VALIDATION_FAILED, "status must be non-negative");
        }
    }

    @Override
    public void markSynced(Instant at) {
        this.syncStatus = SyncStatus.SUCCESS;
        this.lastSyncedAt = at;
    }
}
