package com.shelfsync.converter.service.parser;

import java.util.Collection;

public class UnknownParserException extends RuntimeException {
    private final String parserName;

    public UnknownParserException(String parserName, Collection<String> known) {
        super("Unknown parser '" + parserName + "'. Registered parsers: " + String.join(", ", known));
        this.parserName = parserName;
    }

    public String getParserName() {
        return parserName;
    }
}
