package com.indexcatalog.query;

import com.indexcatalog.codec.KeyCodec;
import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.exception.ConfigurationException;
import com.indexcatalog.exception.ErrorCode;
import com.indexcatalog.exception.StoreException;
import com.indexcatalog.exception.ValidationException;
import com.indexcatalog.index.IndexPartitionWriter;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.storage.FaultInjectingTableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private static final CatalogRecord ANN = CatalogRecord.of("userId", "u1", "email", "a@x.com", "team", "eng", "name", "Ann");
    private static final CatalogRecord BOB = CatalogRecord.of("userId", "u2", "email", "b@x.com", "team", "eng");
    private static final CatalogRecord CAT = CatalogRecord.of("userId", "u3", "email", "c@x.com", "team", "eng");
    private static final CatalogRecord DAN = CatalogRecord.of("userId", "u10", "email", "a@x.com", "team", "ops");

    private CatalogSchema schema;
    private FaultInjectingTableStore indexStore;
    private QueryEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        schema = CatalogSchema.of(List.of("email", "team"), "userId");
        indexStore = new FaultInjectingTableStore("catalog");
        IndexPartitionWriter writer = new IndexPartitionWriter(indexStore, schema);
        for (CatalogRecord r : List.of(ANN, BOB, CAT, DAN)) {
            writer.applyInsert(r);
        }
        engine = new QueryEngine(indexStore, schema);
    }

    @Test
    void singlePredicateReturnsPartitionInContentKeyOrder() throws Exception {
        assertEquals(List.of(ANN, BOB, CAT), engine.query(Map.of("team", "eng"), RowBounds.none()));
        assertEquals(List.of(DAN), engine.query(Map.of("team", "ops"), RowBounds.none()));
    }

    @Test
    void valuesMatchCaseInsensitively() throws Exception {
        assertEquals(List.of(ANN, BOB, CAT), engine.query(Map.of("team", "ENG"), RowBounds.none()));
    }

    @Test
    void resultsCarryOnlyRecordFields() throws Exception {
        List<CatalogRecord> hits = engine.query(Map.of("email", "b@x.com"), RowBounds.none());

        assertEquals(1, hits.size());
        assertEquals(BOB.asMap(), hits.get(0).asMap());
    }

    @Test
    void predicatesAreIntersected() throws Exception {
        Map<String, String> filter = new LinkedHashMap<>();
        filter.put("email", "a@x.com");
        filter.put("team", "eng");

        assertEquals(List.of(ANN), engine.query(filter, RowBounds.none()));
    }

    @Test
    void disjointPredicatesYieldNothing() throws Exception {
        Map<String, String> filter = new LinkedHashMap<>();
        filter.put("email", "b@x.com");
        filter.put("team", "ops");

        assertTrue(engine.query(filter, RowBounds.none()).isEmpty());
    }

    @Test
    void emptyIntersectionStopsScanning() throws Exception {
        indexStore.failOn(FaultInjectingTableStore.Op.QUERY, KeyCodec.partitionKey("team", "eng"));
        Map<String, String> filter = new LinkedHashMap<>();
        filter.put("email", "nobody@x.com");
        filter.put("team", "eng");

        assertTrue(engine.query(filter, RowBounds.none()).isEmpty());
        assertEquals(0, indexStore.injectedFailures());
    }

    @Test
    void storeFailurePropagates() {
        indexStore.failOn(FaultInjectingTableStore.Op.QUERY, KeyCodec.partitionKey("team", "eng"));

        assertThrows(StoreException.class, () -> engine.query(Map.of("team", "eng"), RowBounds.none()));
    }

    @Test
    void rowBoundsAreInclusiveOnPrimaryValue() throws Exception {
        assertEquals(List.of(BOB, CAT), engine.query(Map.of("team", "eng"), RowBounds.of("u2", "u3")));
        assertEquals(List.of(BOB), engine.query(Map.of("team", "eng"), RowBounds.of("u2", "u2")));
        assertEquals(List.of(BOB, CAT), engine.query(Map.of("team", "eng"), RowBounds.of("u2", null)));
        assertEquals(List.of(ANN, BOB), engine.query(Map.of("team", "eng"), RowBounds.of("", "u2")));
    }

    @Test
    void invertedRowBoundsMatchNothing() throws Exception {
        assertTrue(engine.query(Map.of("team", "eng"), RowBounds.of("u9", "u0")).isEmpty());
    }

    @Test
    void rowBoundDoesNotMatchLongerPrimaryWithSamePrefix() throws Exception {
        assertEquals(List.of(ANN), engine.query(Map.of("email", "a@x.com"), RowBounds.of("u1", "u1")));
        assertEquals(List.of(DAN), engine.query(Map.of("email", "a@x.com"), RowBounds.of("u10", "u10")));
    }

    @Test
    void emptyFilterIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> engine.query(Map.of(), RowBounds.none()));
        assertEquals(ErrorCode.EMPTY_FILTER, e.getCode());

        ValidationException nullFilter = assertThrows(ValidationException.class,
            () -> engine.query(null, RowBounds.none()));
        assertEquals(ErrorCode.EMPTY_FILTER, nullFilter.getCode());
    }

    @Test
    void unknownFieldsAreListed() {
        Map<String, String> filter = new LinkedHashMap<>();
        filter.put("team", "eng");
        filter.put("name", "Ann");
        filter.put("userId", "u1");

        ValidationException e = assertThrows(ValidationException.class,
            () -> engine.query(filter, RowBounds.none()));

        assertEquals(ErrorCode.UNKNOWN_FIELD, e.getCode());
        assertEquals(List.of("name", "userId"), e.getFields());
        assertEquals(0, indexStore.injectedFailures());
    }

    @Test
    void nullFilterValueIsRejected() {
        Map<String, String> filter = new HashMap<>();
        filter.put("team", null);

        assertThrows(NullPointerException.class, () -> engine.query(filter, RowBounds.none()));
    }

    @Test
    void unconfiguredSchemaIsRejected() {
        QueryEngine unconfigured = new QueryEngine(indexStore, new CatalogSchema());

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> unconfigured.query(Map.of("team", "eng"), RowBounds.none()));
        assertEquals(ErrorCode.NOT_CONFIGURED, e.getCode());
    }
}
