package com.indexcatalog.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-process {@link TableStore}. Partitions are skip lists ordered by row key.
 */
public class InMemoryTableStore implements TableStore {
    private final String tableName;
    private final ConcurrentSkipListMap<String, ConcurrentSkipListMap<String, TableEntity>> partitions;
    private final AtomicLong etagSequence;

    public InMemoryTableStore(String tableName) {
        this.tableName = tableName;
        this.partitions = new ConcurrentSkipListMap<>();
        this.etagSequence = new AtomicLong();
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    @Override
    public void ensureTable() {
        // nothing to provision
    }

    @Override
    public StoreOutcome create(String partitionKey, String rowKey, Map<String, String> fields) {
        TableEntity previous = partition(partitionKey).putIfAbsent(rowKey, newEntity(partitionKey, rowKey, fields));
        return previous == null ? StoreOutcome.APPLIED : StoreOutcome.ALREADY_EXISTS;
    }

    @Override
    public void upsert(String partitionKey, String rowKey, Map<String, String> fields) {
        partition(partitionKey).put(rowKey, newEntity(partitionKey, rowKey, fields));
    }

    @Override
    public boolean replace(String partitionKey, String rowKey, Map<String, String> fields, String expectedEtag) {
        ConcurrentSkipListMap<String, TableEntity> partition = partition(partitionKey);
        TableEntity current = partition.get(rowKey);
        if (current == null || !current.getEtag().equals(expectedEtag)) {
            return false;
        }
        return partition.replace(rowKey, current, newEntity(partitionKey, rowKey, fields));
    }

    @Override
    public StoreOutcome delete(String partitionKey, String rowKey) {
        ConcurrentSkipListMap<String, TableEntity> partition = partitions.get(partitionKey);
        if (partition == null || partition.remove(rowKey) == null) {
            return StoreOutcome.NOT_FOUND;
        }
        return StoreOutcome.APPLIED;
    }

    @Override
    public Optional<TableEntity> get(String partitionKey, String rowKey) {
        ConcurrentSkipListMap<String, TableEntity> partition = partitions.get(partitionKey);
        return partition == null ? Optional.empty() : Optional.ofNullable(partition.get(rowKey));
    }

    @Override
    public List<TableEntity> query(String partitionKey, RowRange range) {
        ConcurrentSkipListMap<String, TableEntity> partition = partitions.get(partitionKey);
        if (partition == null || range.isEmpty()) {
            return List.of();
        }
        NavigableMap<String, TableEntity> view = partition;
        if (range.getLower() != null) {
            view = view.tailMap(range.getLower(), range.isLowerInclusive());
        }
        if (range.getUpper() != null) {
            view = view.headMap(range.getUpper(), range.isUpperInclusive());
        }
        return new ArrayList<>(view.values());
    }

    /**
     * Number of entities across all partitions.
     */
    public int size() {
        return partitions.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Partition keys that currently hold at least one entity.
     */
    public List<String> partitionKeys() {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, ConcurrentSkipListMap<String, TableEntity>> e : partitions.entrySet()) {
            if (!e.getValue().isEmpty()) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }

    /**
     * Every entity in (partition, row) order.
     */
    public List<TableEntity> snapshot() {
        List<TableEntity> all = new ArrayList<>();
        Collection<ConcurrentSkipListMap<String, TableEntity>> values = partitions.values();
        for (ConcurrentNavigableMap<String, TableEntity> partition : values) {
            all.addAll(partition.values());
        }
        return all;
    }

    private ConcurrentSkipListMap<String, TableEntity> partition(String partitionKey) {
        return partitions.computeIfAbsent(partitionKey, k -> new ConcurrentSkipListMap<>(RowRange.ROW_ORDER));
    }

    private TableEntity newEntity(String partitionKey, String rowKey, Map<String, String> fields) {
        return new TableEntity(partitionKey, rowKey, fields,
                Long.toString(etagSequence.incrementAndGet()), System.currentTimeMillis());
    }
}
