package com.indexsync.elasticsearch;

import com.indexsync.model.IndexNaming;

import java.time.Clock;

/**
 * Resolves the monthly index and stable alias for one entity.
 *
 * <p>The time bucket is read from the clock on every call, so an engine that
 * runs across a month boundary starts writing to the new month's index
 * without a restart.</p>
 */
public class IndexNamer {

    private final String environment;
    private final String service;
    private final String entity;
    private final Clock clock;

    public IndexNamer(String environment, String service, String entity) {
        this(environment, service, entity, Clock.systemUTC());
    }

    public IndexNamer(String environment, String service, String entity, Clock clock) {
        this.environment = environment;
        this.service = service;
        this.entity = entity;
        this.clock = clock;
    }

    public IndexNaming current() {
        return IndexNaming.builder()
                .environment(environment)
                .service(service)
                .entity(entity)
                .timeBucket(clock.instant())
                .build();
    }

    public String currentIndex() {
        return current().getIndexName();
    }

    public String alias() {
        return current().getAliasName();
    }
}
