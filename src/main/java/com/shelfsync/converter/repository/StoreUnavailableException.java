package com.shelfsync.converter.repository;

/** A store location cannot be opened, or its connection was lost mid-run. */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
