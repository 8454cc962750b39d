package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.Unit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Titles with trailing pack tokens: multipacks {@code 2x64г}, single packages {@code 1.5л},
 * piece counts {@code 3шт}. Brand is the run of Latin or capitalized words after the first word.
 * Chizhik and Perekrestok both publish titles in this shape.
 */
public class ChizhikTitleParser implements TitleParser {
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern LATIN = Pattern.compile("[a-z]", Pattern.CASE_INSENSITIVE);

    private final TextNormalizer text;

    public ChizhikTitleParser(TextNormalizer text) {
        this.text = text;
    }

    @Override
    public TitleParseResult parse(String title) {
        String raw = title.trim();
        String nameOriginal = stripPackTokens(raw);
        String brand = extractBrand(nameOriginal);

        Double availableCount = null;
        PackMeasures.Measure measure = null;
        Matcher multipack = PackMeasures.MULTIPACK.matcher(raw);
        while (multipack.find()) {
            availableCount = (double) Integer.parseInt(multipack.group("count"));
            measure = PackMeasures.toPackage(multipack.group("q"), multipack.group("u"));
        }
        if (availableCount == null) {
            Matcher pieces = PackMeasures.PIECE_COUNT.matcher(raw);
            while (pieces.find()) {
                availableCount = (double) Integer.parseInt(pieces.group("count"));
            }
        }
        if (measure == null) {
            measure = PackMeasures.lastQuantity(raw);
        }

        Unit unit;
        Double packageQuantity = null;
        PackageUnit packageUnit = null;
        if (PackMeasures.BY_WEIGHT.matcher(raw).find()) {
            unit = Unit.KGM;
            availableCount = null;
        } else if (PackMeasures.BY_VOLUME.matcher(raw).find()) {
            unit = Unit.LTR;
            availableCount = null;
        } else {
            unit = Unit.PCE;
            if (measure != null) {
                packageQuantity = measure.quantity();
                packageUnit = measure.unit();
            }
        }

        String nameForNormalization = nameOriginal;
        if (brand != null && !nameOriginal.toLowerCase(Locale.ROOT).contains(brand.toLowerCase(Locale.ROOT))) {
            nameForNormalization = nameOriginal + " " + brand;
        }
        String normalized = text.normalize(nameForNormalization);
        return new TitleParseResult(
                raw,
                nameOriginal,
                brand,
                normalized,
                text.removeStopwords(nameOriginal),
                text.removeStopwords(normalized),
                unit,
                availableCount,
                packageQuantity,
                packageUnit);
    }

    static String stripPackTokens(String title) {
        String value = PackMeasures.MULTIPACK.matcher(title).replaceAll(" ");
        value = PackMeasures.QUANTITY.matcher(value).replaceAll(" ");
        value = PackMeasures.PIECE_COUNT.matcher(value).replaceAll(" ");
        value = FixPriceTitleParser.strip(SPACES.matcher(value).replaceAll(" ").trim(), " ,.;:-");
        return value.isEmpty() ? title.trim() : value;
    }

    static String extractBrand(String namePart) {
        List<String> words = new ArrayList<>();
        for (String token : namePart.split("\\s+")) {
            String word = FixPriceTitleParser.strip(token, ".,;:()[]{}\"'«»");
            if (!word.isEmpty()) words.add(word);
        }
        if (words.size() < 2) return null;

        List<String> candidates = new ArrayList<>();
        for (String word : words.subList(1, words.size())) {
            if (word.chars().anyMatch(Character::isDigit)) break;
            if (LATIN.matcher(word).find() || startsUpperCase(word)) {
                candidates.add(word);
                if (candidates.size() == 3) break;
                continue;
            }
            break;
        }
        return candidates.isEmpty() ? null : String.join(" ", candidates);
    }

    private static boolean startsUpperCase(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) return Character.isUpperCase(c);
        }
        return false;
    }
}
