package com.indexsync.bulk;

import com.indexsync.error.SyncException;

import java.util.List;

/**
 * Told what became of buffered operations: applied by a bulk submission, or
 * dropped from the buffer for good.
 */
@FunctionalInterface
public interface FlushListener {

    void onFlushed(List<BulkOperation> applied);

    /**
     * Called for an operation the buffer gave up on, either because the cluster
     * rejected it or because it ran out of attempts.  Listeners are called in
     * registration order; one that throws stops the rest and the operation goes
     * back into the buffer.
     */
    default void onRejected(BulkOperation rejected, SyncException error) throws SyncException {
    }
}
