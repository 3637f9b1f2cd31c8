package com.indexsync.categories;

import com.indexsync.categories.model.Category;
import com.indexsync.model.EntityDescriptor;

/**
 * Entity descriptors contributed by this module.
 */
public final class CategoryEntities {

    public static final EntityDescriptor<Category> CATEGORY = EntityDescriptor.<Category>builder()
            .entityClass(Category.class)
            .entityType("category")
            .indexEntity("categories")
            .topicSuffix("categories")
            .templateName("categories-template")
            .templateResource("index-templates/categories-template.json")
            .build();

    private CategoryEntities() {
    }
}
