package com.indexcatalog.exception;

import java.util.List;

/**
 * Caller input that cannot be accepted: missing record fields, an empty filter
 * or a filter on a field that is not indexed.
 */
public class ValidationException extends CatalogException {

    private final List<String> fields;

    public ValidationException(ErrorCode code, String message, List<String> fields) {
        super(code, message);
        this.fields = List.copyOf(fields);
    }

    /**
     * The offending field names (missing fields or unknown filter fields).
     */
    public List<String> getFields() {
        return fields;
    }
}
