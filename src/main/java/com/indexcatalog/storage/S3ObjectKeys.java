package com.indexcatalog.storage;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Maps table/partition/row keys onto S3 object keys.
 * <p>
 * Partition and row keys are hex-encoded UTF-8, so any character (including
 * {@code /}) is safe inside an object key and S3's byte-wise listing order
 * matches the byte-wise order of the unencoded keys.
 */
public final class S3ObjectKeys {
    private static final HexFormat HEX = HexFormat.of();
    private static final char SEPARATOR = '/';

    private S3ObjectKeys() {
    }

    public static String encode(String key) {
        return HEX.formatHex(key.getBytes(StandardCharsets.UTF_8));
    }

    public static String decode(String encoded) {
        return new String(HEX.parseHex(encoded), StandardCharsets.UTF_8);
    }

    public static String partitionPrefix(String tableName, String partitionKey) {
        return tableName + SEPARATOR + encode(partitionKey) + SEPARATOR;
    }

    public static String objectKey(String tableName, String partitionKey, String rowKey) {
        return partitionPrefix(tableName, partitionKey) + encode(rowKey);
    }

    /**
     * A listing start-after marker that admits {@code rowKey} itself: the encoding
     * with its last byte dropped is a proper prefix, so it sorts strictly below.
     */
    public static String startAfterInclusive(String tableName, String partitionKey, String rowKey) {
        String encoded = encode(rowKey);
        String truncated = encoded.isEmpty() ? encoded : encoded.substring(0, encoded.length() - 2);
        return partitionPrefix(tableName, partitionKey) + truncated;
    }

    public static String startAfterExclusive(String tableName, String partitionKey, String rowKey) {
        return objectKey(tableName, partitionKey, rowKey);
    }

    /**
     * Recovers the row key from an object key listed under {@code prefix}.
     */
    public static String rowKeyOf(String prefix, String objectKey) {
        return decode(objectKey.substring(prefix.length()));
    }
}
