package com.indexcatalog.storage;

/**
 * Result of a conditional write against a {@link TableStore}.
 */
public enum StoreOutcome {
    /** The write took effect. */
    APPLIED,
    /** {@code create} found the (partition, row) pair already occupied. */
    ALREADY_EXISTS,
    /** {@code delete} found nothing at the (partition, row) pair. */
    NOT_FOUND
}
