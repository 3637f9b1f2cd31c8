package com.indexsync.kafka;

import java.util.OptionalLong;
import java.util.PriorityQueue;

/**
 * Tracks in-flight offsets of one partition and yields the next offset that is
 * safe to commit.
 *
 * <p>Offsets are registered in poll order and completed in any order.  The
 * committable position is the smallest still-pending offset, or one past the
 * highest offset ever registered once nothing is pending.</p>
 */
class OffsetTracker {

    private final PriorityQueue<Long> pending = new PriorityQueue<>();
    private long highWatermark = -1;

    synchronized void register(long offset) {
        pending.add(offset);
        highWatermark = Math.max(highWatermark, offset);
    }

    synchronized void complete(long offset) {
        pending.remove(offset);
    }

    synchronized OptionalLong committable() {
        Long head = pending.peek();
        if (head != null) {
            return OptionalLong.of(head);
        }
        return highWatermark < 0 ? OptionalLong.empty() : OptionalLong.of(highWatermark + 1);
    }

    synchronized int pendingCount() {
        return pending.size();
    }
}
