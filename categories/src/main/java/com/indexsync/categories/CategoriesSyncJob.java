package com.indexsync.categories;

import com.indexsync.IndexSyncJobBase;
import com.indexsync.categories.model.Category;
import com.indexsync.model.EntityDescriptor;

/**
 * Entry point for the categories sync job.
 *
 * <p>All engine logic lives in the common module. This class only supplies
 * the config resource and the category descriptor.</p>
 */
public class CategoriesSyncJob extends IndexSyncJobBase<Category> {

    @Override
    protected String getDefaultConfigResource() {
        return "sync-config.yaml";
    }

    @Override
    protected EntityDescriptor<Category> getDescriptor() {
        return CategoryEntities.CATEGORY;
    }

    public static void main(String[] args) throws Exception {
        new CategoriesSyncJob().run(args);
    }
}
