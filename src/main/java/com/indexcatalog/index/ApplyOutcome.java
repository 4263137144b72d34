package com.indexcatalog.index;

/**
 * What applying one WAL entry did to the index partitions.
 */
public enum ApplyOutcome {
    /** At least one index-partition entry was created or removed. */
    APPLIED,
    /** Insert found every index-partition entry already in place. */
    ALREADY_APPLIED,
    /** Delete found none of the index-partition entries. */
    NOT_PRESENT
}
