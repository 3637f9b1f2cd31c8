package com.indexsync.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Elasticsearch cluster connection and index provisioning configuration.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private List<String> hosts;
    private String username;
    private String password;
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;
    private int maxConnections = 10;
    private int maxConnectionsPerRoute = 5;
    private boolean gzipEnabled = true;
    /** Refresh the affected shards after every index and bulk request. */
    private boolean refreshOnWrite = true;

    // ── Provisioning ─────────────────────────────────────────────────────

    private int shardCount = 3;
    private int replicaCount = 1;
    private String lifecyclePolicy = "digital-discovery-policy";
    /** How often the current month's index and alias are re-checked. */
    private long aliasRefreshIntervalMs = 3_600_000;
}
