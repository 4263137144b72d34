package com.indexcatalog.exception;

/**
 * The backing store rejected or failed an operation.
 */
public class StoreException extends CatalogException {

    public StoreException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
