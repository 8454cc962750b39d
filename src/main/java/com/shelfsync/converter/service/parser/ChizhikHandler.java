package com.shelfsync.converter.service.parser;

import java.util.regex.Pattern;

public class ChizhikHandler extends AbstractParserHandler {
    public static final String PARSER_NAME = "chizhik";

    private static final Pattern CATEGORY_SEPARATORS = Pattern.compile("[/,]+");

    public ChizhikHandler(TextNormalizer text) {
        this(PARSER_NAME, text);
    }

    protected ChizhikHandler(String parserName, TextNormalizer text) {
        super(parserName, new ChizhikTitleParser(text), text);
    }

    /** Category path flattened to words with stop words removed, e.g. "Молоко, сыр и яйца" -> "молоко сыр яйца". */
    @Override
    protected String normalizeCategory(String category) {
        String normalized = super.normalizeCategory(category);
        if (normalized == null) return null;
        String flattened = text.normalize(CATEGORY_SEPARATORS.matcher(normalized).replaceAll(" "));
        if (flattened.isEmpty()) return null;
        String withoutStopwords = text.removeStopwords(flattened);
        return withoutStopwords.isEmpty() ? flattened : withoutStopwords;
    }
}
