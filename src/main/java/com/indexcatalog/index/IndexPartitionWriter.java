package com.indexcatalog.index;

import com.indexcatalog.codec.KeyCodec;
import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.exception.StoreException;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.storage.StoreOutcome;
import com.indexcatalog.storage.TableStore;

/**
 * Fans a record out to one index partition per index-key field, all under the
 * record's content key. Both directions are idempotent.
 */
public class IndexPartitionWriter {
    private final TableStore indexStore;
    private final CatalogSchema schema;

    public IndexPartitionWriter(TableStore indexStore, CatalogSchema schema) {
        this.indexStore = indexStore;
        this.schema = schema;
    }

    /**
     * Creates the missing index-partition entries for {@code record}. Entries that
     * already exist are left untouched, not merged.
     */
    public ApplyOutcome applyInsert(CatalogRecord record) throws StoreException {
        String contentKey = contentKey(record);
        boolean created = false;
        for (String field : schema.getIndexKeys()) {
            String partitionKey = KeyCodec.partitionKey(field, record.get(field));
            if (indexStore.create(partitionKey, contentKey, record.asMap()) == StoreOutcome.APPLIED) {
                created = true;
            }
        }
        return created ? ApplyOutcome.APPLIED : ApplyOutcome.ALREADY_APPLIED;
    }

    /**
     * Removes whichever index-partition entries for {@code record} still exist.
     */
    public ApplyOutcome applyDelete(CatalogRecord record) throws StoreException {
        String contentKey = contentKey(record);
        boolean removed = false;
        for (String field : schema.getIndexKeys()) {
            String partitionKey = KeyCodec.partitionKey(field, record.get(field));
            if (indexStore.delete(partitionKey, contentKey) == StoreOutcome.APPLIED) {
                removed = true;
            }
        }
        return removed ? ApplyOutcome.APPLIED : ApplyOutcome.NOT_PRESENT;
    }

    public String contentKey(CatalogRecord record) {
        return KeyCodec.contentKey(record.asMap(), schema.getPrimaryField(), schema.getIndexKeys());
    }
}
