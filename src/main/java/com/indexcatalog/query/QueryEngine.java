package com.indexcatalog.query;

import com.indexcatalog.codec.KeyCodec;
import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.exception.CatalogException;
import com.indexcatalog.exception.ErrorCode;
import com.indexcatalog.exception.StoreException;
import com.indexcatalog.exception.ValidationException;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.storage.RowRange;
import com.indexcatalog.storage.TableEntity;
import com.indexcatalog.storage.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Answers equality filters from single-attribute index partitions.
 * <p>
 * Each predicate is one partition scan. Several predicates are AND-ed by intersecting
 * the scans on content key, which costs O(predicates x partition size) and is meant
 * for a handful of predicates, not many.
 */
public class QueryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

    private final TableStore indexStore;
    private final CatalogSchema schema;

    public QueryEngine(TableStore indexStore, CatalogSchema schema) {
        this.indexStore = indexStore;
        this.schema = schema;
    }

    /**
     * Records matching every (field, value) pair of {@code filter}.
     * <p>
     * Results follow content-key order of the first predicate's partition.
     */
    public List<CatalogRecord> query(Map<String, String> filter, RowBounds bounds) throws CatalogException {
        schema.requireLocked();
        validate(filter);

        RowRange range = bounds.toRowRange();
        Iterator<Map.Entry<String, String>> predicates = filter.entrySet().iterator();

        Map.Entry<String, String> first = predicates.next();
        Map<String, CatalogRecord> results = scan(first.getKey(), first.getValue(), range);

        while (predicates.hasNext() && !results.isEmpty()) {
            Map.Entry<String, String> next = predicates.next();
            Set<String> matches = scan(next.getKey(), next.getValue(), range).keySet();
            results.keySet().retainAll(matches);
        }

        LOG.debug("Query {} {} -> {} records", filter, bounds, results.size());
        return new ArrayList<>(results.values());
    }

    private void validate(Map<String, String> filter) throws ValidationException {
        if (filter == null || filter.isEmpty()) {
            throw new ValidationException(ErrorCode.EMPTY_FILTER, "Filter must name at least one index key", List.of());
        }
        List<String> unknown = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, String> e : filter.entrySet()) {
            if (!schema.isIndexKey(e.getKey()) && seen.add(e.getKey())) {
                unknown.add(e.getKey());
            }
            Objects.requireNonNull(e.getValue(), () -> "filter value for " + e.getKey());
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException(ErrorCode.UNKNOWN_FIELD,
                "Not an index key: " + unknown + " (index keys: " + schema.getIndexKeys() + ")", unknown);
        }
    }

    /**
     * One partition scan, keyed by content key in ascending order.
     */
    private Map<String, CatalogRecord> scan(String field, String value, RowRange range) throws StoreException {
        String partitionKey = KeyCodec.partitionKey(field, value);
        Map<String, CatalogRecord> hits = new LinkedHashMap<>();
        for (TableEntity entity : indexStore.query(partitionKey, range)) {
            hits.put(entity.getRowKey(), CatalogRecord.of(entity.getFields()));
        }
        return hits;
    }
}
