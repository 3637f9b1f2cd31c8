package com.indexsync.kafka;

/**
 * Lifecycle of a {@link ConsumerGroupRunner}.
 */
public enum RunnerStatus {
    INITIALIZED,
    STARTING,
    RUNNING,
    ERROR,
    STOPPED,
    CLOSED
}
