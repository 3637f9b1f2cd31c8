package com.indexsync.kafka;

import com.indexsync.error.SyncException;
import com.indexsync.sync.MessageOutcome;
import com.indexsync.sync.SyncContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Processes one consumed record on its partition worker.
 */
@FunctionalInterface
public interface RecordProcessor {

    /**
     * @throws SyncException only for failures that must leave the offset uncommitted
     */
    MessageOutcome process(SyncContext ctx, ConsumerRecord<String, byte[]> record) throws SyncException;
}
