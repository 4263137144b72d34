package com.indexcatalog.exception;

/**
 * Schema unset, schema re-set after lock, or required settings missing.
 * Fatal to the call and never retried internally.
 */
public class ConfigurationException extends CatalogException {

    public ConfigurationException(ErrorCode code, String message) {
        super(code, message);
    }
}
