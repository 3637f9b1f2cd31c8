package com.indexsync.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time health of the engine and its two external dependencies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthReport {

    /** {@code UP} only when every dependency is up. */
    private ComponentStatus status;
    private ComponentStatus elasticsearch;
    private ComponentStatus kafka;
    private Instant timestamp;

    public boolean isUp() {
        return status == ComponentStatus.UP;
    }
}
