package com.indexcatalog.storage;

import java.util.Comparator;

/**
 * Row-key bounds for a partition scan. A {@code null} bound is open.
 * <p>
 * Row keys are ordered by Unicode code point, which is also the byte order of their
 * UTF-8 encoding and therefore the order S3 lists them in.
 */
public final class RowRange {
    public static final Comparator<String> ROW_ORDER = RowRange::compareCodePoints;

    private static final RowRange ALL = new RowRange(null, false, null, false);

    private final String lower;
    private final boolean lowerInclusive;
    private final String upper;
    private final boolean upperInclusive;

    private RowRange(String lower, boolean lowerInclusive, String upper, boolean upperInclusive) {
        this.lower = lower;
        this.lowerInclusive = lowerInclusive;
        this.upper = upper;
        this.upperInclusive = upperInclusive;
    }

    public static RowRange all() {
        return ALL;
    }

    /** Rows strictly greater than {@code rowKey}; open when {@code rowKey} is null. */
    public static RowRange after(String rowKey) {
        return new RowRange(rowKey, false, null, false);
    }

    /** Rows in {@code [from, to]}; either side may be null. */
    public static RowRange between(String from, String to) {
        return new RowRange(from, true, to, true);
    }

    public String getLower() { return lower; }
    public boolean isLowerInclusive() { return lowerInclusive; }
    public String getUpper() { return upper; }
    public boolean isUpperInclusive() { return upperInclusive; }

    public boolean contains(String rowKey) {
        return !isBelow(rowKey) && !isAbove(rowKey);
    }

    /**
     * True when no row key can satisfy both bounds, e.g. a lower bound above the upper one.
     */
    public boolean isEmpty() {
        if (lower == null || upper == null) {
            return false;
        }
        int cmp = ROW_ORDER.compare(lower, upper);
        return cmp > 0 || (cmp == 0 && !(lowerInclusive && upperInclusive));
    }

    private boolean isBelow(String rowKey) {
        if (lower == null) {
            return false;
        }
        int cmp = ROW_ORDER.compare(rowKey, lower);
        return lowerInclusive ? cmp < 0 : cmp <= 0;
    }

    boolean isAbove(String rowKey) {
        if (upper == null) {
            return false;
        }
        int cmp = ROW_ORDER.compare(rowKey, upper);
        return upperInclusive ? cmp > 0 : cmp >= 0;
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public String toString() {
        return (lower == null ? "(*" : (lowerInclusive ? "[" : "(") + lower)
                + ", "
                + (upper == null ? "*)" : upper + (upperInclusive ? "]" : ")"));
    }
}
