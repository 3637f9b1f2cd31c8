package com.indexsync.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kafka coordinates of the record an operation was decoded from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourcePosition {

    private String topic;
    private int partition;
    private long offset;

    @Override
    public String toString() {
        return topic + "-" + partition + "@" + offset;
    }
}
