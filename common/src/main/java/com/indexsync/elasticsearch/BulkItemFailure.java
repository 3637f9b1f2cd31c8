package com.indexsync.elasticsearch;

import com.indexsync.error.SyncException;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One action of a bulk request that the cluster did not apply.
 */
@Data
@AllArgsConstructor
public class BulkItemFailure {

    /** Zero-based position of the action in the submitted body. */
    private int position;
    private String id;
    private int status;
    private String type;
    private String reason;

    /** The failure classified the same way as a single-document write with this status. */
    public SyncException toException() {
        return new SyncException(ElasticsearchIndexWriter.codeForStatus(status),
                "bulk item rejected with status " + status + ": " + type + " " + reason, "bulk", id, null);
    }
}
