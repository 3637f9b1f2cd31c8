package com.indexsync.status;

import com.indexsync.config.SyncMode;
import com.indexsync.elasticsearch.ClusterHealth;
import com.indexsync.kafka.RunnerStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncModeStatus {

    private SyncMode mode;
    private boolean enabled;
    private String currentIndex;
    /** Null while no consumer runner has been started. */
    private RunnerStatus consumerStatus;
    private ClusterHealth elasticsearch;
}
