package com.indexsync.bulk;

import com.indexsync.model.OperationType;
import com.indexsync.model.SourcePosition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * One buffered write, already validated and resolved to its target index.
 */
@Data
@AllArgsConstructor
@Builder
public class BulkOperation {

    private OperationType operation;
    private String index;
    private String id;
    /** Document body for index and update actions; null for deletes. */
    private Object document;
    /** Record the operation was decoded from, released once the bulk is applied. */
    private SourcePosition source;
    /** Key of the source record, kept so a rejected write can be dead-lettered. */
    private String sourceKey;
    /** Raw value of the source record. */
    @ToString.Exclude
    private byte[] sourceValue;

    public BulkOperation(OperationType operation, String index, String id, Object document, SourcePosition source) {
        this(operation, index, id, document, source, null, null);
    }
}
