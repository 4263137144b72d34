package com.indexcatalog.wal;

/**
 * Mutation intent recorded in a WAL entry.
 */
public enum WalOperation {
    INSERT("insert"),
    DELETE("delete");

    private final String tag;

    WalOperation(String tag) {
        this.tag = tag;
    }

    /** Stored form of the operation. */
    public String tag() {
        return tag;
    }

    public static WalOperation fromTag(String tag) {
        for (WalOperation op : values()) {
            if (op.tag.equals(tag)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown WAL operation: " + tag);
    }
}
