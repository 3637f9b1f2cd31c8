package com.indexsync.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything the generic engine needs to know about one synchronised entity type.
 *
 * <p>Domain modules declare one instance, e.g.:
 * <pre>
 *   EntityDescriptor.&lt;Category&gt;builder()
 *       .entityClass(Category.class)
 *       .entityType("category")
 *       .indexEntity("categories")
 *       .topicSuffix("categories")
 *       .templateName("categories-template")
 *       .templateResource("index-templates/categories-template.json")
 *       .build();
 * </pre>
 *
 * @param <T> the synchronised entity type
 */
@Getter
@Builder
@ToString
public class EntityDescriptor<T extends SyncEntity> {

    private final Class<T> entityClass;
    /** Singular name used in logs, metrics tags and sync records. */
    private final String entityType;
    /** Plural name used as the entity segment of index and alias names. */
    private final String indexEntity;
    /** Appended to the configured topic prefix to form the source topic. */
    private final String topicSuffix;
    private final String templateName;
    /** Classpath resource holding the index template body. */
    private final String templateResource;
}
