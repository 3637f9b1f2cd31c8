package com.indexsync.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.serde.JsonMappers;

import java.util.List;

/**
 * Encodes buffered operations as an Elasticsearch {@code _bulk} NDJSON body.
 *
 * <pre>
 *   {"index":{"_index":"prod-digital-discovery-categories-2025-04","_id":"c1"}}
 *   {"id":"c1","name":"Pulsa",...}
 *   {"update":{"_index":"...","_id":"c1"}}
 *   {"doc":{...},"doc_as_upsert":true}
 *   {"delete":{"_index":"...","_id":"c2"}}
 * </pre>
 */
public class BulkRequestEncoder {

    private final ObjectMapper objectMapper;

    public BulkRequestEncoder() {
        this(JsonMappers.create());
    }

    public BulkRequestEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(List<BulkOperation> operations) throws SyncException {
        StringBuilder body = new StringBuilder();
        try {
            for (BulkOperation op : operations) {
                String action = switch (op.getOperation()) {
                    case CREATE -> "index";
                    case UPDATE -> "update";
                    case DELETE -> "delete";
                };
                ObjectNode line = objectMapper.createObjectNode();
                line.putObject(action)
                        .put("_index", op.getIndex())
                        .put("_id", op.getId());
                body.append(objectMapper.writeValueAsString(line)).append('\n');

                switch (op.getOperation()) {
                    case CREATE -> body.append(objectMapper.writeValueAsString(op.getDocument())).append('\n');
                    case UPDATE -> {
                        ObjectNode update = objectMapper.createObjectNode();
                        update.set("doc", objectMapper.valueToTree(op.getDocument()));
                        update.put("doc_as_upsert", true);
                        body.append(objectMapper.writeValueAsString(update)).append('\n');
                    }
                    default -> {
                        // deletes carry no body
                    }
                }
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SyncException(ErrorCode.DATA_TRANSFORM, "cannot encode bulk body: " + e.getMessage(), e);
        }
        return body.toString();
    }
}
