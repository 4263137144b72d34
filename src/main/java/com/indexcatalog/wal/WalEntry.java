package com.indexcatalog.wal;

import com.indexcatalog.core.CatalogRecord;

/**
 * Write-Ahead Log entry. Entries are immutable once appended.
 */
public class WalEntry {
    private final String id;
    private final WalOperation operation;
    private final CatalogRecord payload;

    public WalEntry(String id, WalOperation operation, CatalogRecord payload) {
        this.id = id;
        this.operation = operation;
        this.payload = payload;
    }

    /** Sortable identifier; lexicographic order approximates append order. */
    public String getId() { return id; }
    public WalOperation getOperation() { return operation; }
    public CatalogRecord getPayload() { return payload; }

    @Override
    public String toString() {
        return "WalEntry{id=" + id + ", operation=" + operation.tag() + ", payload=" + payload + "}";
    }
}
