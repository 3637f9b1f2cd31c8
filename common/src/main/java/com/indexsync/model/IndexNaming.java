package com.indexsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Inputs of the index naming scheme {@code {env}-{service}-{entity}-{yyyy-MM}}.
 * Example: {@code prod-digital-discovery-categories-2025-04}.
 */
@Data
@AllArgsConstructor
@Builder
public class IndexNaming {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM")
            .withZone(ZoneOffset.UTC);

    private String environment;
    private String service;
    private String entity;
    private Instant timeBucket;

    public String getIndexName() {
        return getAliasName() + "-" + MONTH.format(timeBucket);
    }

    public String getAliasName() {
        return environment + "-" + service + "-" + entity;
    }
}
