package com.indexcatalog.schema;

import com.indexcatalog.exception.ConfigurationException;
import com.indexcatalog.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Which fields are indexed and which field is the record's natural identity.
 * <p>
 * The schema locks on the first successful {@code set}; it can never be changed afterwards.
 */
public class CatalogSchema {
    private volatile List<String> indexKeys;
    private volatile String primaryField;

    public CatalogSchema() {
    }

    /**
     * Creates an already-locked schema.
     */
    public static CatalogSchema of(List<String> indexKeys, String primaryField) throws ConfigurationException {
        CatalogSchema schema = new CatalogSchema();
        schema.set(indexKeys, primaryField);
        return schema;
    }

    /**
     * Sets and locks the schema from a comma-separated list of index keys.
     */
    public void set(String commaSeparatedIndexKeys, String primaryField) throws ConfigurationException {
        List<String> keys = commaSeparatedIndexKeys == null
            ? List.of()
            : Arrays.stream(commaSeparatedIndexKeys.split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
        set(keys, primaryField);
    }

    public synchronized void set(List<String> indexKeys, String primaryField) throws ConfigurationException {
        if (isLocked()) {
            throw new ConfigurationException(ErrorCode.ALREADY_CONFIGURED,
                "Schema is already configured and locked");
        }
        if (indexKeys == null || indexKeys.isEmpty() || primaryField == null || primaryField.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_SCHEMA,
                "Both index keys and a primary field must be provided");
        }

        List<String> keys = new ArrayList<>(indexKeys.size());
        for (String key : indexKeys) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException(ErrorCode.INVALID_SCHEMA, "Index key names must not be blank");
            }
            keys.add(key.trim());
        }
        if (new LinkedHashSet<>(keys).size() != keys.size()) {
            throw new ConfigurationException(ErrorCode.INVALID_SCHEMA, "Duplicate index keys: " + keys);
        }

        this.primaryField = primaryField.trim();
        this.indexKeys = List.copyOf(keys);
    }

    public boolean isLocked() {
        return indexKeys != null;
    }

    public void requireLocked() throws ConfigurationException {
        if (!isLocked()) {
            throw new ConfigurationException(ErrorCode.NOT_CONFIGURED, "Schema is not configured");
        }
    }

    /** Index-key fields in declaration order; empty before the schema is set. */
    public List<String> getIndexKeys() {
        List<String> keys = indexKeys;
        return keys != null ? keys : List.of();
    }

    public String getPrimaryField() {
        return primaryField;
    }

    public boolean isIndexKey(String field) {
        return getIndexKeys().contains(field);
    }

    /**
     * Index keys followed by the primary field; the fields every inserted record must carry.
     */
    public List<String> requiredFields() {
        List<String> required = new ArrayList<>(getIndexKeys());
        if (primaryField != null && !required.contains(primaryField)) {
            required.add(primaryField);
        }
        return required;
    }

    @Override
    public String toString() {
        return "CatalogSchema{indexKeys=" + indexKeys + ", primaryField=" + primaryField + "}";
    }
}
