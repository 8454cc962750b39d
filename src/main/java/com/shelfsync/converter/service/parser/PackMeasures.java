package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.PackageUnit;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Title patterns for weights, volumes, multipacks, piece counts and bulk markers,
 * plus conversion of a matched quantity to canonical {@code KGM}/{@code LTR}.
 */
final class PackMeasures {
    private PackMeasures() {}

    private static final String QTY = "(?<q>\\d+(?:[.,]\\d+)?)\\s*(?<u>кг|г|мл|л|kg|g|ml|l)(?!\\p{L})";

    static final Pattern QUANTITY = Pattern.compile(QTY, TextNormalizer.FLAGS);
    static final Pattern MULTIPACK = Pattern.compile("(?<count>\\d+)\\s*[xх×*]\\s*" + QTY, TextNormalizer.FLAGS);
    static final Pattern PIECE_COUNT = Pattern.compile("(?<count>\\d+)\\s*(?:шт|штук|pcs|pc)(?!\\p{L})", TextNormalizer.FLAGS);
    static final Pattern DIMENSIONS_CM = Pattern.compile(
            "\\d+(?:[.,]\\d+)?\\s*[xх×]\\s*\\d+(?:[.,]\\d+)?(?:\\s*[xх×]\\s*\\d+(?:[.,]\\d+)?)?\\s*см(?!\\p{L})",
            TextNormalizer.FLAGS);
    static final Pattern BY_WEIGHT = Pattern.compile(
            "(?<!\\p{L})(?:весов(?:ой|ая|ое|ые)?|на\\s+вес|by\\s+weight)(?!\\p{L})", TextNormalizer.FLAGS);
    static final Pattern BY_VOLUME = Pattern.compile(
            "(?<!\\p{L})(?:на\\s+розлив|розлив|разлив|by\\s+volume|on\\s+tap)(?!\\p{L})", TextNormalizer.FLAGS);

    record Measure(double quantity, PackageUnit unit) {}

    /** g and ml are scaled by 0.001; kg and l are kept. */
    static Measure toPackage(String quantity, String unit) {
        double q = Double.parseDouble(quantity.replace(',', '.').trim());
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "г", "g" -> new Measure(q / 1000.0, PackageUnit.KGM);
            case "кг", "kg" -> new Measure(q, PackageUnit.KGM);
            case "мл", "ml" -> new Measure(q / 1000.0, PackageUnit.LTR);
            case "л", "l" -> new Measure(q, PackageUnit.LTR);
            default -> null;
        };
    }

    static Measure lastQuantity(String title) {
        Matcher m = QUANTITY.matcher(title);
        Measure last = null;
        while (m.find()) {
            last = toPackage(m.group("q"), m.group("u"));
        }
        return last;
    }

    static Measure firstQuantity(String title) {
        Matcher m = QUANTITY.matcher(title);
        return m.find() ? toPackage(m.group("q"), m.group("u")) : null;
    }
}
