package com.indexsync.sync;

/**
 * What became of one consumed record.
 */
public enum MessageOutcome {
    /** Written to the index. */
    APPLIED,
    /** Nothing to write (tombstone) or terminally rejected and acknowledged. */
    SKIPPED,
    /** Transient failures exhausted the retry budget; acknowledged after the failure queue. */
    FAILED,
    /** Held in the bulk buffer; acknowledged once the buffer is flushed. */
    BUFFERED
}
