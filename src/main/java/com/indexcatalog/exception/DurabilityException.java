package com.indexcatalog.exception;

/**
 * A WAL append was not made durable. The mutation is not committed and may be
 * retried from scratch.
 */
public class DurabilityException extends CatalogException {

    public DurabilityException(String message, Throwable cause) {
        super(ErrorCode.DURABILITY_FAILURE, message, cause);
    }

    public DurabilityException(String message) {
        super(ErrorCode.DURABILITY_FAILURE, message);
    }
}
