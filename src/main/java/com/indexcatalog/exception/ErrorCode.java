package com.indexcatalog.exception;

/**
 * Machine-readable reason attached to every {@link CatalogException}.
 */
public enum ErrorCode {
    NOT_CONFIGURED,
    ALREADY_CONFIGURED,
    INVALID_SCHEMA,
    MISSING_CONFIGURATION,

    MISSING_FIELDS,
    EMPTY_FILTER,
    UNKNOWN_FIELD,

    STORE_UNAVAILABLE,
    DURABILITY_FAILURE,
    REPLAY_FAILURE
}
