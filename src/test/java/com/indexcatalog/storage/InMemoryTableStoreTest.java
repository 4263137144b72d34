package com.indexcatalog.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTableStoreTest {

    private InMemoryTableStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTableStore("test");
        store.upsert("p", "b", Map.of("v", "2"));
        store.upsert("p", "a", Map.of("v", "1"));
        store.upsert("p", "d", Map.of("v", "4"));
        store.upsert("p", "c", Map.of("v", "3"));
        store.upsert("other", "a", Map.of("v", "x"));
    }

    @Test
    void createReportsOccupiedSlotWithoutOverwriting() {
        assertEquals(StoreOutcome.APPLIED, store.create("p", "e", Map.of("v", "5")));
        assertEquals(StoreOutcome.ALREADY_EXISTS, store.create("p", "a", Map.of("v", "changed")));

        assertEquals("1", store.get("p", "a").orElseThrow().getField("v"));
    }

    @Test
    void deleteReportsMissingEntity() {
        assertEquals(StoreOutcome.APPLIED, store.delete("p", "a"));
        assertEquals(StoreOutcome.NOT_FOUND, store.delete("p", "a"));
        assertEquals(StoreOutcome.NOT_FOUND, store.delete("nowhere", "a"));
        assertTrue(store.get("p", "a").isEmpty());
    }

    @Test
    void queryReturnsSinglePartitionInRowKeyOrder() {
        assertEquals(List.of("a", "b", "c", "d"), rowKeys(store.query("p", RowRange.all())));
        assertEquals(List.of("a"), rowKeys(store.query("other", RowRange.all())));
        assertTrue(store.query("missing", RowRange.all()).isEmpty());
    }

    @Test
    void afterIsExclusive() {
        assertEquals(List.of("c", "d"), rowKeys(store.query("p", RowRange.after("b"))));
        assertEquals(List.of("a", "b", "c", "d"), rowKeys(store.query("p", RowRange.after(null))));
    }

    @Test
    void betweenIsInclusiveOnBothEnds() {
        assertEquals(List.of("b", "c"), rowKeys(store.query("p", RowRange.between("b", "c"))));
        assertEquals(List.of("c", "d"), rowKeys(store.query("p", RowRange.between("bb", null))));
        assertEquals(List.of("a", "b"), rowKeys(store.query("p", RowRange.between(null, "b"))));
    }

    @Test
    void invertedBoundsMatchNothing() {
        assertTrue(store.query("p", RowRange.between("d", "a")).isEmpty());
        assertEquals(List.of("b"), rowKeys(store.query("p", RowRange.between("b", "b"))));
        assertTrue(RowRange.between("d", "a").isEmpty());
        assertFalse(RowRange.between("a", null).isEmpty());
    }

    @Test
    void containsHonoursInclusivity() {
        assertTrue(RowRange.between("b", "c").contains("b"));
        assertTrue(RowRange.between("b", "c").contains("c"));
        assertFalse(RowRange.between("b", "c").contains("d"));
        assertFalse(RowRange.after("b").contains("b"));
        assertTrue(RowRange.all().contains(""));
    }

    @Test
    void replaceHonoursEtag() {
        TableEntity current = store.get("p", "a").orElseThrow();

        assertFalse(store.replace("p", "a", Map.of("v", "x"), "stale"));
        assertTrue(store.replace("p", "a", Map.of("v", "x"), current.getEtag()));
        assertFalse(store.replace("p", "a", Map.of("v", "y"), current.getEtag()), "etag changes on every write");
        assertFalse(store.replace("p", "zz", Map.of("v", "y"), current.getEtag()));

        assertEquals("x", store.get("p", "a").orElseThrow().getField("v"));
    }

    @Test
    void entityFieldsAreImmutableCopies() {
        TableEntity entity = store.get("p", "a").orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> entity.getFields().put("v", "z"));
        assertEquals(Map.of("v", "1"), entity.getFields());
    }

    private static List<String> rowKeys(List<TableEntity> entities) {
        return entities.stream().map(TableEntity::getRowKey).collect(Collectors.toList());
    }
}
