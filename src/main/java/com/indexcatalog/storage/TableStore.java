package com.indexcatalog.storage;

import com.indexcatalog.exception.StoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One table of a partitioned key-value store.
 * <p>
 * Every entity is addressed by an opaque (partition key, row key) pair. Scans
 * target a single partition and return entities in ascending row-key order.
 * "Already exists" and "not found" are reported as {@link StoreOutcome} values;
 * {@link StoreException} is reserved for genuine store failures.
 */
public interface TableStore extends AutoCloseable {

    /** Table name, used for logging. */
    String getTableName();

    /**
     * Makes sure the table can be written to, provisioning it when missing.
     */
    void ensureTable() throws StoreException;

    /**
     * Inserts the entity unless the (partition, row) pair is occupied.
     *
     * @return {@link StoreOutcome#APPLIED} or {@link StoreOutcome#ALREADY_EXISTS}
     */
    StoreOutcome create(String partitionKey, String rowKey, Map<String, String> fields) throws StoreException;

    /** Unconditional write-or-replace. */
    void upsert(String partitionKey, String rowKey, Map<String, String> fields) throws StoreException;

    /**
     * Replaces an existing entity only if its etag still matches.
     *
     * @return false when the entity changed or vanished since it was read
     */
    boolean replace(String partitionKey, String rowKey, Map<String, String> fields, String expectedEtag)
            throws StoreException;

    /**
     * @return {@link StoreOutcome#APPLIED} or {@link StoreOutcome#NOT_FOUND}
     */
    StoreOutcome delete(String partitionKey, String rowKey) throws StoreException;

    Optional<TableEntity> get(String partitionKey, String rowKey) throws StoreException;

    /**
     * Scans one partition, restricted to {@code range}, in ascending row-key order.
     */
    List<TableEntity> query(String partitionKey, RowRange range) throws StoreException;

    @Override
    default void close() {
    }
}
