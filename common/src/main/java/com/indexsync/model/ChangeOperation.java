package com.indexsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A decoded change event: what happened, to which entity, and when.
 *
 * <p>For {@code DELETE} the payload is the entity's last known state (the
 * envelope's {@code before}); it is only used for its id.</p>
 *
 * @param <T> the synchronised entity type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChangeOperation<T extends SyncEntity> {

    private OperationType operation;
    private T payload;
    private Instant occurredAt;
    /** Null when the operation did not come from Kafka. */
    private SourcePosition source;

    public String getEntityId() {
        return payload != null ? payload.getId() : null;
    }
}
