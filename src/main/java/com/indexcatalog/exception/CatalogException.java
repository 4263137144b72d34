package com.indexcatalog.exception;

/**
 * Base exception for catalog operations
 */
public class CatalogException extends Exception {

    private final ErrorCode code;

    public CatalogException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CatalogException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
