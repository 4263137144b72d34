package com.indexcatalog.storage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class S3ObjectKeysTest {

    @Test
    void keysWithSlashesStayInsideOneSegment() {
        String key = S3ObjectKeys.objectKey("users", "5_emaila/b", "u1/x:0a1b2c3d");

        assertEquals(2, key.chars().filter(c -> c == '/').count());
        assertTrue(key.startsWith("users/"));
        assertEquals("u1/x:0a1b2c3d",
            S3ObjectKeys.rowKeyOf(S3ObjectKeys.partitionPrefix("users", "5_emaila/b"), key));
    }

    @Test
    void encodingPreservesByteOrder() {
        List<String> rowKeys = List.of("", "a", "a:", "a:z", "ab", "b", "u10:00", "u1:ff", "u2:00");
        List<String> encoded = new ArrayList<>();
        for (String rowKey : rowKeys) {
            encoded.add(S3ObjectKeys.encode(rowKey));
        }

        List<String> sorted = new ArrayList<>(encoded);
        sorted.sort(null);
        assertEquals(encoded, sorted);
    }

    @Test
    void inclusiveStartAfterSortsBelowTheKeyItself() {
        String key = S3ObjectKeys.objectKey("t", "p", "u1:");
        String inclusive = S3ObjectKeys.startAfterInclusive("t", "p", "u1:");
        String exclusive = S3ObjectKeys.startAfterExclusive("t", "p", "u1:");

        assertTrue(inclusive.compareTo(key) < 0);
        assertEquals(key, exclusive);
        assertTrue(inclusive.startsWith(S3ObjectKeys.partitionPrefix("t", "p")));
    }

    @Test
    void emptyRowKeyStartsAtPartitionPrefix() {
        assertEquals(S3ObjectKeys.partitionPrefix("t", "p"), S3ObjectKeys.startAfterInclusive("t", "p", ""));
    }
}
