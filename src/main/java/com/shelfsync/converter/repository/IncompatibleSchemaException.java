package com.shelfsync.converter.repository;

/** A store lacks a table or column the converter reads or writes. Raised before any write. */
public class IncompatibleSchemaException extends RuntimeException {
    public IncompatibleSchemaException(String message) {
        super(message);
    }
}
