package com.indexcatalog.core;

/**
 * When WAL entries written by a mutation are applied to the index.
 */
public enum ReplayPolicy {
    /**
     * Each mutation replays every unapplied entry before returning, so its effect is
     * visible to the next query unless replay fails.
     */
    CATCH_UP,

    /**
     * Mutations return as soon as the WAL append is durable. Entries are applied by
     * an explicit {@code recover()} or by background recovery.
     */
    DEFERRED
}
