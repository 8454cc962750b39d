package com.shelfsync.converter.service.parser;

public class DuplicateHandlerException extends RuntimeException {
    public DuplicateHandlerException(String parserName) {
        super("Parser handler already registered: " + parserName);
    }
}
