package com.indexsync.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.model.ChangeEnvelope;
import com.indexsync.model.ChangeOperation;
import com.indexsync.model.OperationType;
import com.indexsync.model.SourcePosition;
import com.indexsync.model.SyncEntity;

import java.io.IOException;
import java.time.Instant;

/**
 * Decodes raw Kafka record values (Debezium JSON envelopes) into typed
 * {@link ChangeOperation}s.
 *
 * <p>Accepts both the schema-wrapped form {@code {"schema": ..., "payload": {...}}}
 * and the bare payload emitted when the converter has schemas disabled.
 * {@code CREATE} and {@code UPDATE} bind the {@code after} row image,
 * {@code DELETE} binds {@code before}.</p>
 *
 * @param <T> the synchronised entity type
 */
public class ChangeEventDecoder<T extends SyncEntity> {

    private final Class<T> entityClass;
    private final ObjectMapper objectMapper;

    public ChangeEventDecoder(Class<T> entityClass) {
        this(entityClass, JsonMappers.create());
    }

    public ChangeEventDecoder(Class<T> entityClass, ObjectMapper objectMapper) {
        this.entityClass = entityClass;
        this.objectMapper = objectMapper;
    }

    /**
     * @param value  record value bytes, never empty
     * @param source where the record came from; may be null
     * @throws SyncException {@code INVALID_PAYLOAD}, {@code UNKNOWN_OPERATION} or {@code DATA_TRANSFORM}
     */
    public ChangeOperation<T> decode(byte[] value, SourcePosition source) throws SyncException {
        JsonNode root;
        try {
            root = objectMapper.readTree(value);
        } catch (IOException e) {
            throw new SyncException(ErrorCode.INVALID_PAYLOAD, "unparseable change event: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SyncException(ErrorCode.INVALID_PAYLOAD, "change event is not a JSON object");
        }

        JsonNode payloadNode = root.path("payload").isObject() ? root.get("payload") : root;
        ChangeEnvelope.Payload payload;
        try {
            payload = objectMapper.treeToValue(payloadNode, ChangeEnvelope.Payload.class);
        } catch (JsonProcessingException e) {
            throw new SyncException(ErrorCode.INVALID_PAYLOAD, "malformed change envelope: " + e.getOriginalMessage(), e);
        }

        if (payload.getOp() == null || payload.getOp().isBlank()) {
            throw new SyncException(ErrorCode.INVALID_PAYLOAD, "change envelope has no op");
        }
        Long tsMs = payload.getSource() != null ? payload.getSource().getTsMs() : null;
        if (tsMs == null || tsMs == 0L) {
            throw new SyncException(ErrorCode.INVALID_PAYLOAD, "change envelope has no source.ts_ms");
        }

        String opCode = payload.getOp();
        OperationType operation = OperationType.fromCode(opCode)
                .orElseThrow(() -> new SyncException(ErrorCode.UNKNOWN_OPERATION,
                        "unknown operation code '" + opCode + "'"));

        JsonNode snapshot = operation == OperationType.DELETE ? payload.getBefore() : payload.getAfter();
        if (snapshot == null || snapshot.isNull() || snapshot.isMissingNode()) {
            throw new SyncException(ErrorCode.DATA_TRANSFORM,
                    "no " + (operation == OperationType.DELETE ? "before" : "after")
                            + " image for " + operation.tag(), operation.tag(), null, null);
        }

        T entity;
        try {
            entity = objectMapper.treeToValue(snapshot, entityClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SyncException(ErrorCode.DATA_TRANSFORM,
                    "row image does not bind to " + entityClass.getSimpleName() + ": " + e.getMessage(),
                    operation.tag(), null, e);
        }
        if (entity == null) {
            throw new SyncException(ErrorCode.DATA_TRANSFORM, "row image bound to null", operation.tag(), null, null);
        }

        return ChangeOperation.<T>builder()
                .operation(operation)
                .payload(entity)
                .occurredAt(Instant.ofEpochMilli(tsMs))
                .source(source)
                .build();
    }
}
