package com.indexsync.config;

/**
 * Which component moves change events into the index.
 *
 * <ul>
 *   <li>{@code CUSTOM} – this engine consumes the topic and writes to Elasticsearch.</li>
 *   <li>{@code KAFKA_CONNECT} – an external sink connector does; the engine stays idle.</li>
 * </ul>
 */
public enum SyncMode {
    CUSTOM,
    KAFKA_CONNECT
}
