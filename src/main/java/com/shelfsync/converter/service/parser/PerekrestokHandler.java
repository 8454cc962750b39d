package com.shelfsync.converter.service.parser;

/** Perekrestok titles and categories follow the Chizhik rules. */
public class PerekrestokHandler extends ChizhikHandler {
    public static final String PARSER_NAME = "perekrestok";

    public PerekrestokHandler(TextNormalizer text) {
        super(PARSER_NAME, text);
    }
}
