package com.shelfsync.converter.service.parser;

/**
 * Site-specific title grammar. May throw on titles it cannot read; the handler turns that
 * into a partial record.
 */
public interface TitleParser {
    TitleParseResult parse(String title);
}
