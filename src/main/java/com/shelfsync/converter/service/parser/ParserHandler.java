package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.RawProduct;

/**
 * Turns one raw receiver row of a specific upstream site into a {@link NormalizedProduct}.
 *
 * <p>Implementations are deterministic and side-effect free: the same raw row always yields
 * the same record. A title the grammar cannot read never aborts the call; the handler returns
 * whatever it could extract with null unit and quantity fields instead.
 *
 * @see ParserHandlerRegistry
 * @see AbstractParserHandler
 */
public interface ParserHandler {

    /** Registry key, lower case (e.g. {@code fixprice}). */
    String parserName();

    NormalizedProduct normalize(RawProduct raw);
}
