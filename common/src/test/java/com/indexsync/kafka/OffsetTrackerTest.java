package com.indexsync.kafka;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OffsetTracker Tests")
class OffsetTrackerTest {

    @Test
    @DisplayName("Nothing is committable before any offset is registered")
    void emptyTracker() {
        assertThat(new OffsetTracker().committable()).isEmpty();
    }

    @Test
    @DisplayName("The smallest pending offset bounds the commit")
    void pendingOffsetBoundsCommit() {
        OffsetTracker tracker = new OffsetTracker();
        for (long offset = 10; offset < 15; offset++) {
            tracker.register(offset);
        }

        tracker.complete(10);
        tracker.complete(12);
        tracker.complete(13);

        assertThat(tracker.committable()).hasValue(11);
        assertThat(tracker.pendingCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("With nothing pending the commit is one past the high watermark")
    void allCompleted() {
        OffsetTracker tracker = new OffsetTracker();
        tracker.register(3);
        tracker.register(4);

        tracker.complete(4);
        tracker.complete(3);

        assertThat(tracker.committable()).hasValue(5);
        assertThat(tracker.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Completing an unknown offset changes nothing")
    void unknownOffset() {
        OffsetTracker tracker = new OffsetTracker();
        tracker.register(7);

        tracker.complete(99);

        assertThat(tracker.committable()).hasValue(7);
    }
}
