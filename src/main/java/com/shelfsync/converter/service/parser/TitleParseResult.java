package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.Unit;

/**
 * What a title grammar extracted from one product title. Unit and quantity fields may be null
 * when the title does not carry them.
 */
public record TitleParseResult(
        String rawTitle,
        String nameOriginal,
        String brand,
        String nameNormalized,
        String originalNoStopwords,
        String normalizedNoStopwords,
        Unit unit,
        Double availableCount,
        Double packageQuantity,
        PackageUnit packageUnit
) {}
