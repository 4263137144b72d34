package com.indexcatalog.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored entity addressed by (partition key, row key).
 * <p>
 * {@link #getFields()} holds only user fields; the keys, the etag and the write
 * timestamp are storage metadata and are kept apart from the fields.
 */
public class TableEntity {
    private final String partitionKey;
    private final String rowKey;
    private final Map<String, String> fields;
    private final String etag;
    private final long timestamp;

    public TableEntity(String partitionKey, String rowKey, Map<String, String> fields,
                       String etag, long timestamp) {
        this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
        this.rowKey = Objects.requireNonNull(rowKey, "rowKey");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.etag = etag;
        this.timestamp = timestamp;
    }

    public String getPartitionKey() { return partitionKey; }
    public String getRowKey() { return rowKey; }
    public Map<String, String> getFields() { return fields; }
    public String getEtag() { return etag; }
    public long getTimestamp() { return timestamp; }

    public String getField(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return "TableEntity{pk=" + partitionKey + ", rk=" + rowKey + ", fields=" + fields + ", etag=" + etag + "}";
    }
}
