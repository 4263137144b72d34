package com.indexcatalog;

import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.core.IndexCatalog;
import com.indexcatalog.core.ReplayPolicy;
import com.indexcatalog.exception.ValidationException;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.storage.InMemoryTableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private IndexCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        catalog = new IndexCatalog(CatalogSchema.of(List.of("email", "team"), "userId"),
            new InMemoryTableStore("catalog"), new InMemoryTableStore("catalog_WAL"), ReplayPolicy.CATCH_UP);
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    @Test
    void insertQueryAndDeleteCommands() throws Exception {
        Main.execute(catalog, "insert {\"userId\":\"u1\",\"email\":\"a@x.com\",\"team\":\"eng\"}");
        Main.execute(catalog, "insert {\"userId\":\"u2\",\"email\":\"b@x.com\",\"team\":\"eng\"}");
        Main.execute(catalog, "query {\"team\":\"eng\"} u1 u1");

        assertEquals(2, catalog.query(Map.of("team", "eng")).size());

        Main.execute(catalog, "delete {\"team\":\"eng\"} u2");

        assertEquals(List.of(CatalogRecord.of("userId", "u1", "email", "a@x.com", "team", "eng")),
            catalog.query(Map.of("team", "eng")));
    }

    @Test
    void catalogErrorsPropagate() {
        assertThrows(ValidationException.class, () -> Main.execute(catalog, "query {\"name\":\"Ann\"}"));
        assertThrows(ValidationException.class, () -> Main.execute(catalog, "insert {\"userId\":\"u1\"}"));
    }

    @Test
    void malformedArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Main.execute(catalog, "query team=eng"));
        assertThrows(IllegalArgumentException.class, () -> Main.execute(catalog, "insert"));
        assertThrows(IllegalArgumentException.class,
            () -> Main.execute(catalog, "insert {\"userId\":\"u1\",\"email\":null,\"team\":\"eng\"}"));
        assertThrows(IllegalArgumentException.class, () -> Main.execute(catalog, "query {\"team\":null}"));
    }

    @Test
    void invertedBoundsDeleteNothing() throws Exception {
        Main.execute(catalog, "insert {\"userId\":\"u1\",\"email\":\"a@x.com\",\"team\":\"eng\"}");

        Main.execute(catalog, "query {\"team\":\"eng\"} u9 u0");
        Main.execute(catalog, "delete {\"team\":\"eng\"} u9 u0");

        assertEquals(1, catalog.query(Map.of("team", "eng")).size());
    }

    @Test
    void informationalCommandsSucceed() throws Exception {
        Main.execute(catalog, "recover");
        Main.execute(catalog, "checkpoint");
        Main.execute(catalog, "help");
        Main.execute(catalog, "bogus");
    }
}
