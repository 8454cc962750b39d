package com.shelfsync.converter.service.parser;

import java.util.Map;
import java.util.regex.Pattern;

public class FixPriceHandler extends AbstractParserHandler {
    public static final String PARSER_NAME = "fixprice";

    private static final Pattern COMMA_SPACES = Pattern.compile("\\s*,\\s*");

    private static final Map<String, String> CATEGORY_ALIASES = Map.of(
            "напитки и соки", "напитки",
            "канцтовары", "канцелярия",
            "бытовая химия и уборка", "бытовая химия"
    );

    private static final Map<String, String> GEO_ALIASES = Map.of(
            "российская федерация", "россия"
    );

    public FixPriceHandler(TextNormalizer text) {
        super(PARSER_NAME, new FixPriceTitleParser(text), text);
    }

    @Override
    protected String normalizeCategory(String category) {
        String normalized = super.normalizeCategory(category);
        return normalized == null ? null : CATEGORY_ALIASES.getOrDefault(normalized, normalized);
    }

    @Override
    protected String normalizeGeo(String geo) {
        String normalized = super.normalizeGeo(geo);
        return normalized == null ? null : GEO_ALIASES.getOrDefault(normalized, normalized);
    }

    @Override
    protected String normalizeComposition(String composition) {
        String normalized = super.normalizeComposition(composition);
        return normalized == null ? null : COMMA_SPACES.matcher(normalized).replaceAll(", ");
    }
}
