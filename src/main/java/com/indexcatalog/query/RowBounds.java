package com.indexcatalog.query;

import com.indexcatalog.codec.KeyCodec;
import com.indexcatalog.storage.RowRange;

/**
 * Optional inclusive bounds on the primary-value portion of content keys.
 */
public final class RowBounds {
    private static final RowBounds NONE = new RowBounds(null, null);

    private final String rowFrom;
    private final String rowTo;

    private RowBounds(String rowFrom, String rowTo) {
        this.rowFrom = rowFrom;
        this.rowTo = rowTo;
    }

    public static RowBounds none() {
        return NONE;
    }

    /**
     * Either bound may be null or empty, meaning open on that side.
     */
    public static RowBounds of(String rowFrom, String rowTo) {
        String from = rowFrom == null || rowFrom.isEmpty() ? null : rowFrom;
        String to = rowTo == null || rowTo.isEmpty() ? null : rowTo;
        return from == null && to == null ? NONE : new RowBounds(from, to);
    }

    public String getRowFrom() { return rowFrom; }
    public String getRowTo() { return rowTo; }

    RowRange toRowRange() {
        return RowRange.between(
            rowFrom != null ? KeyCodec.contentKeyLowerBound(rowFrom) : null,
            rowTo != null ? KeyCodec.contentKeyUpperBound(rowTo) : null);
    }

    @Override
    public String toString() {
        return "RowBounds[" + rowFrom + ", " + rowTo + "]";
    }
}
