package com.indexcatalog.schema;

import com.indexcatalog.exception.ConfigurationException;
import com.indexcatalog.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogSchemaTest {

    @Test
    void setLocksSchema() throws Exception {
        CatalogSchema schema = new CatalogSchema();
        assertFalse(schema.isLocked());

        schema.set(List.of("email", "team"), "userId");

        assertTrue(schema.isLocked());
        assertEquals(List.of("email", "team"), schema.getIndexKeys());
        assertEquals("userId", schema.getPrimaryField());
        assertEquals(List.of("email", "team", "userId"), schema.requiredFields());
    }

    @Test
    void secondSetFailsAndKeepsFirstSchema() throws Exception {
        CatalogSchema schema = CatalogSchema.of(List.of("email"), "userId");

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> schema.set(List.of("team"), "id"));

        assertEquals(ErrorCode.ALREADY_CONFIGURED, e.getCode());
        assertEquals(List.of("email"), schema.getIndexKeys());
        assertEquals("userId", schema.getPrimaryField());
    }

    @Test
    void emptyIndexKeysOrPrimaryFieldAreInvalid() {
        assertEquals(ErrorCode.INVALID_SCHEMA, assertThrows(ConfigurationException.class,
            () -> new CatalogSchema().set(List.of(), "userId")).getCode());
        assertEquals(ErrorCode.INVALID_SCHEMA, assertThrows(ConfigurationException.class,
            () -> new CatalogSchema().set(List.of("email"), " ")).getCode());
        assertEquals(ErrorCode.INVALID_SCHEMA, assertThrows(ConfigurationException.class,
            () -> new CatalogSchema().set(" , ,", "userId")).getCode());
        assertEquals(ErrorCode.INVALID_SCHEMA, assertThrows(ConfigurationException.class,
            () -> new CatalogSchema().set(List.of("email", "email"), "userId")).getCode());
    }

    @Test
    void invalidAttemptDoesNotLock() throws Exception {
        CatalogSchema schema = new CatalogSchema();
        assertThrows(ConfigurationException.class, () -> schema.set(List.of(), "userId"));

        schema.set(List.of("email"), "userId");
        assertTrue(schema.isLocked());
    }

    @Test
    void commaSeparatedKeysAreTrimmed() throws Exception {
        CatalogSchema schema = new CatalogSchema();
        schema.set(" email, team ,,", "userId");

        assertEquals(List.of("email", "team"), schema.getIndexKeys());
    }

    @Test
    void requireLockedFailsBeforeSet() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new CatalogSchema().requireLocked());
        assertEquals(ErrorCode.NOT_CONFIGURED, e.getCode());
    }

    @Test
    void primaryFieldMayAlsoBeIndexed() throws Exception {
        CatalogSchema schema = CatalogSchema.of(List.of("userId", "email"), "userId");
        assertEquals(List.of("userId", "email"), schema.requiredFields());
    }
}
