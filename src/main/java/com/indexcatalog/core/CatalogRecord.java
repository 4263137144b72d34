package com.indexcatalog.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable record: field names mapped to scalar values.
 * <p>
 * Scalars are held in their string form; numbers and booleans passed to
 * {@link #of(Map)} are rendered with {@link String#valueOf(Object)}.
 */
public final class CatalogRecord {
    private final Map<String, String> fields;

    private CatalogRecord(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CatalogRecord of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : fields.entrySet()) {
            Object value = e.getValue();
            if (value == null) {
                throw new IllegalArgumentException("Field '" + e.getKey() + "' is null");
            }
            if (value instanceof Map || value instanceof Iterable) {
                throw new IllegalArgumentException("Field '" + e.getKey() + "' is not a scalar");
            }
            copy.put(Objects.requireNonNull(e.getKey(), "field name"),
                String.valueOf(value));
        }
        return new CatalogRecord(copy);
    }

    /**
     * Builds a record from alternating names and values.
     */
    public static CatalogRecord of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return of(fields);
    }

    @JsonValue
    public Map<String, String> asMap() {
        return fields;
    }

    public String get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * The subset of {@code required} that this record lacks, in the given order.
     */
    public List<String> missing(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!fields.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogRecord)) return false;
        return fields.equals(((CatalogRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
