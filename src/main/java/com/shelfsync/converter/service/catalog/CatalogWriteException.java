package com.shelfsync.converter.service.catalog;

/** A product could not be written; the surrounding transaction is rolled back. */
public class CatalogWriteException extends RuntimeException {
    public CatalogWriteException(String message) {
        super(message);
    }

    public CatalogWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
