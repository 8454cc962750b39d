package com.shelfsync.converter.service.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserHandlerRegistryTest {
    private final TextNormalizer text = new TextNormalizer();

    @Test
    public void resolvesCaseInsensitively() {
        ParserHandlerRegistry registry = new ParserHandlerRegistry().register(new FixPriceHandler(text));
        assertEquals("fixprice", registry.resolve(" FixPrice ").parserName());
    }

    @Test
    public void duplicateNameIsRejected() {
        ParserHandlerRegistry registry = new ParserHandlerRegistry().register(new ChizhikHandler(text));
        DuplicateHandlerException ex = assertThrows(DuplicateHandlerException.class,
                () -> registry.register("CHIZHIK", new ChizhikHandler(text)));
        assertTrue(ex.getMessage().contains("chizhik"));
    }

    @Test
    public void blankNameIsRejected() {
        ParserHandlerRegistry registry = new ParserHandlerRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("  ", new FixPriceHandler(text)));
    }

    @Test
    public void unknownParserListsRegisteredOnes() {
        ParserHandlerRegistry registry = new ParserHandlerRegistry()
                .register(new PerekrestokHandler(text))
                .register(new FixPriceHandler(text));
        UnknownParserException ex = assertThrows(UnknownParserException.class, () -> registry.resolve("magnit"));
        assertEquals("magnit", ex.getParserName());
        assertTrue(ex.getMessage().contains("fixprice, perekrestok"), ex.getMessage());
        assertEquals(List.of("fixprice", "perekrestok"), registry.registeredParsers());
    }
}
